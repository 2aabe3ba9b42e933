package pinning;

import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.gui2.BasicWindow;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.screen.Screen;
import com.googlecode.lanterna.terminal.DefaultTerminalFactory;
import java.io.IOException;
import pinning.truststore.TrustAnchorLoader;
import pinning.ui.MainScreen;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        DefaultTerminalFactory terminalFactory = new DefaultTerminalFactory();
        terminalFactory.setInitialTerminalSize(new TerminalSize(140, 42));

        try {
            Screen screen = terminalFactory.createScreen();
            screen.startScreen();

            MultiWindowTextGUI gui = new MultiWindowTextGUI(screen);
            BasicWindow window = new BasicWindow("mTLS pinning console");
            MainScreen mainScreen = new MainScreen(gui, window, new TrustAnchorLoader());

            window.setComponent(mainScreen.create());
            gui.addWindowAndWait(window);
            mainScreen.close();
            screen.stopScreen();
        } catch (IOException e) {
            System.err.println("Failed to start console: " + e.getMessage());
            System.exit(1);
        }
    }
}
