package pinning.ui;

import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.gui2.BasicWindow;
import com.googlecode.lanterna.gui2.Borders;
import com.googlecode.lanterna.gui2.Button;
import com.googlecode.lanterna.gui2.Direction;
import com.googlecode.lanterna.gui2.Label;
import com.googlecode.lanterna.gui2.LinearLayout;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.gui2.Panel;
import com.googlecode.lanterna.gui2.TextBox;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import pinning.cert.CertificateDecoder;
import pinning.cert.CertificateModel;

public final class CertificateDetailsDialog {
    private static final DateTimeFormatter DETAILS_DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
        .withZone(ZoneId.systemDefault());

    private CertificateDetailsDialog() {
    }

    public static void show(MultiWindowTextGUI gui, CertificateModel cert) {
        BasicWindow detailsWindow = Dialogs.modal("Certificate details");

        Panel root = new Panel(new LinearLayout(Direction.VERTICAL));
        root.addComponent(new Label("Chain index: " + cert.chainIndex() + (cert.isLeaf() ? " (leaf)" : "")));
        root.addComponent(new Label("Subject: " + cert.subjectDn()));
        root.addComponent(new Label("Issuer: " + cert.issuerDn()));
        root.addComponent(new Label("Subject CN: " + cert.subjectCn()));
        root.addComponent(new Label("Issuer CN: " + cert.issuerCn() + "   Issuer O: " + cert.issuerO()));
        root.addComponent(new Label("Serial: " + cert.serialNumberHex()));
        root.addComponent(new Label("NotBefore: " + DETAILS_DATE_FORMATTER.format(cert.notBefore())));
        root.addComponent(new Label("NotAfter: " + DETAILS_DATE_FORMATTER.format(cert.notAfter())));
        root.addComponent(new Label(cert.thumbprintAlgorithm().digestName() + ": " + cert.thumbprintHex()));
        root.addComponent(new Label("DNS names:"));
        if (cert.dnsNames().isEmpty()) {
            root.addComponent(new Label("  <none>"));
        } else {
            for (String dnsName : cert.dnsNames()) {
                root.addComponent(new Label("  - " + dnsName));
            }
        }

        // Base64 DER is the format the reference variable expects.
        TextBox encoded = new TextBox(
            new TerminalSize(66, 8),
            CertificateDecoder.encodeBase64(cert),
            TextBox.Style.MULTI_LINE
        );
        encoded.setReadOnly(true);
        root.addComponent(encoded.withBorder(Borders.singleLine("Base64 DER")));

        Panel actions = new Panel(new LinearLayout(Direction.HORIZONTAL));
        actions.addComponent(new Button("Show PEM", () -> {
            TextBox pem = new TextBox(new TerminalSize(66, 8), CertificateDecoder.encodePem(cert), TextBox.Style.MULTI_LINE);
            pem.setReadOnly(true);
            BasicWindow pemWindow = Dialogs.modal("PEM");
            Panel pemRoot = new Panel(new LinearLayout(Direction.VERTICAL));
            pemRoot.addComponent(pem);
            pemRoot.addComponent(new Button("Close", pemWindow::close));
            pemWindow.setComponent(pemRoot);
            gui.addWindowAndWait(pemWindow);
        }));
        actions.addComponent(new Button("Close", detailsWindow::close));

        root.addComponent(actions.withBorder(Borders.singleLine("Actions")));
        detailsWindow.setComponent(root.withBorder(Borders.singleLine("Full certificate information")));
        gui.addWindowAndWait(detailsWindow);
    }
}
