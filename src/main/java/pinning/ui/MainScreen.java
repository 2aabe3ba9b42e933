package pinning.ui;

import com.googlecode.lanterna.gui2.Borders;
import com.googlecode.lanterna.gui2.Button;
import com.googlecode.lanterna.gui2.Direction;
import com.googlecode.lanterna.gui2.Label;
import com.googlecode.lanterna.gui2.LinearLayout;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.gui2.Panel;
import com.googlecode.lanterna.gui2.Window;
import com.googlecode.lanterna.gui2.dialogs.MessageDialog;
import com.googlecode.lanterna.gui2.dialogs.MessageDialogButton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pinning.PinningClient;
import pinning.check.PinCheckService;
import pinning.config.PinningSettings;
import pinning.identity.ClientIdentity;
import pinning.pin.PinningReference;
import pinning.tls.TrustAnchorVerifier;
import pinning.truststore.LoadedTrustAnchors;
import pinning.truststore.TrustAnchorLoader;

public class MainScreen {
    private static final Logger log = LoggerFactory.getLogger(MainScreen.class);

    private final MultiWindowTextGUI gui;
    private final Window window;
    private final TrustAnchorLoader trustAnchorLoader;

    private PinningClient client;
    private Label statusLabel;
    private Label settingsLabel;
    private Label referenceLabel;
    private Label identityLabel;

    public MainScreen(MultiWindowTextGUI gui, Window window, TrustAnchorLoader trustAnchorLoader) {
        this.gui = gui;
        this.window = window;
        this.trustAnchorLoader = trustAnchorLoader;
    }

    public Panel create() {
        Panel root = new Panel(new LinearLayout(Direction.VERTICAL));

        settingsLabel = new Label("");
        statusLabel = new Label("");
        referenceLabel = new Label("");
        identityLabel = new Label("");

        Panel topRow = new Panel(new LinearLayout(Direction.HORIZONTAL));
        topRow.addComponent(settingsLabel.withBorder(Borders.singleLine("Configuration")));
        topRow.addComponent(statusLabel.withBorder(Borders.singleLine("Status")));

        Panel actionButtons = new Panel(new LinearLayout(Direction.HORIZONTAL));
        actionButtons.addComponent(new Button("Reload", this::reloadClient));
        actionButtons.addComponent(new Button("Pin check", this::openPinCheck));
        actionButtons.addComponent(new Button("Exit", window::close));

        root.addComponent(topRow);
        root.addComponent(actionButtons);
        root.addComponent(referenceLabel.withBorder(Borders.singleLine("Pinning reference")));
        root.addComponent(identityLabel.withBorder(Borders.singleLine("Client identity")));
        reloadClient();
        return root;
    }

    public void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }

    private void reloadClient() {
        close();
        referenceLabel.setText("");
        identityLabel.setText("");
        try {
            PinningSettings settings = PinningSettings.fromEnvironment();
            settingsLabel.setText(describe(settings));

            LoadedTrustAnchors anchors = trustAnchorLoader.load(
                settings.trustAnchorSource(),
                settings.trustAnchorLocation(),
                settings.trustAnchorPassword()
            );
            TrustAnchorVerifier verifier = trustAnchorLoader.verifierFor(anchors);
            client = PinningClient.create(settings, verifier);

            referenceLabel.setText(client.orchestrator().reference()
                .map(MainScreen::describe)
                .orElse("None configured. Every handshake is rejected"
                    + (settings.bootstrapEnabled() ? "; presented roots are logged for capture." : ".")));
            identityLabel.setText(client.clientIdentity()
                .map(MainScreen::describe)
                .orElse("None configured"));
            statusLabel.setText("Client ready. Trust anchors: " + anchors.sourceDescription());
        } catch (Exception e) {
            log.error("Failed to build pinning client", e);
            String error = Dialogs.errorMessage(e);
            statusLabel.setText("Failed: " + Dialogs.shorten(error, 120));
            MessageDialog.showMessageDialog(gui, "Configuration error", error, MessageDialogButton.OK);
        }
    }

    private void openPinCheck() {
        if (client == null) {
            MessageDialog.showMessageDialog(gui, "Pin check", "Fix the configuration and reload first", MessageDialogButton.OK);
            return;
        }
        PinCheckDialog.show(gui, new PinCheckService(client.orchestrator()));
    }

    private static String describe(PinningSettings settings) {
        return "Reference: " + (settings.hasReference() ? "configured" : "none")
            + "\nClient bundle: " + (settings.clientPkcs12Path() != null
                ? settings.clientPkcs12Path()
                : settings.clientPkcs12Bundle() != null ? "inline" : "none")
            + "\nThumbprint: " + settings.thumbprintAlgorithm().digestName()
            + "\nBootstrap disclosure: " + (settings.bootstrapEnabled() ? "enabled" : "disabled")
            + "\nTrust anchors: " + settings.trustAnchorSource()
            + (settings.trustAnchorLocation() == null ? "" : " " + settings.trustAnchorLocation());
    }

    private static String describe(PinningReference reference) {
        return "Subject CN: " + reference.subjectCn()
            + "\nIssuer CN: " + reference.issuerCn()
            + "\nIssuer O: " + reference.issuerO()
            + "\n" + reference.thumbprintAlgorithm().digestName() + ": " + reference.thumbprintHex();
    }

    private static String describe(ClientIdentity identity) {
        return "Alias: " + identity.alias()
            + "\nSubject: " + identity.leaf().subjectDn()
            + "\nKey: " + identity.keyAlgorithm()
            + "\nChain length: " + identity.certificateChain().size();
    }
}
