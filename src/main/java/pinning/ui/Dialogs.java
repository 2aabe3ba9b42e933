package pinning.ui;

import com.googlecode.lanterna.gui2.BasicWindow;
import com.googlecode.lanterna.gui2.Window;
import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.input.KeyType;
import java.util.List;

public final class Dialogs {
    private Dialogs() {
    }

    /**
     * Modal window that closes on Escape.
     */
    public static BasicWindow modal(String title) {
        BasicWindow window = new BasicWindow(title) {
            @Override
            public boolean handleInput(KeyStroke keyStroke) {
                if (keyStroke != null && keyStroke.getKeyType() == KeyType.Escape) {
                    close();
                    return true;
                }
                return super.handleInput(keyStroke);
            }
        };
        window.setHints(List.of(Window.Hint.MODAL));
        return window;
    }

    static String errorMessage(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String primary = messageOrClass(error);
        String rootMessage = messageOrClass(root);
        if (root == error || rootMessage.equals(primary)) {
            return primary;
        }
        return primary + "\nRoot cause: " + rootMessage;
    }

    static String shorten(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)) + "...";
    }

    private static String messageOrClass(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
