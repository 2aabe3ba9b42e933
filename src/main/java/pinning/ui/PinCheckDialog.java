package pinning.ui;

import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.gui2.BasicWindow;
import com.googlecode.lanterna.gui2.Borders;
import com.googlecode.lanterna.gui2.Button;
import com.googlecode.lanterna.gui2.Direction;
import com.googlecode.lanterna.gui2.GridLayout;
import com.googlecode.lanterna.gui2.Label;
import com.googlecode.lanterna.gui2.LinearLayout;
import com.googlecode.lanterna.gui2.MultiWindowTextGUI;
import com.googlecode.lanterna.gui2.Panel;
import com.googlecode.lanterna.gui2.TextBox;
import com.googlecode.lanterna.gui2.table.Table;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import pinning.cert.CertificateModel;
import pinning.check.PinCheckReport;
import pinning.check.PinCheckService;

public final class PinCheckDialog {
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd")
        .withZone(ZoneId.systemDefault());

    private PinCheckDialog() {
    }

    public static void show(MultiWindowTextGUI gui, PinCheckService checkService) {
        BasicWindow dialog = Dialogs.modal("Pin check");

        Panel request = new Panel(new GridLayout(2));
        TextBox hostInput = new TextBox(new TerminalSize(48, 1));
        TextBox portInput = new TextBox("443");
        Label resultLabel = new Label("");

        request.addComponent(new Label("Host"));
        request.addComponent(hostInput);
        request.addComponent(new Label("Port"));
        request.addComponent(portInput);

        Panel actions = new Panel(new LinearLayout(Direction.HORIZONTAL));
        actions.addComponent(new Button("Run check", () -> {
            String host = hostInput.getText().trim();
            Integer port = parsePort(host, portInput.getText().trim(), resultLabel);
            if (port == null) {
                return;
            }
            resultLabel.setText("Connecting to " + host + ":" + port + "...");
            Thread worker = new Thread(() -> {
                PinCheckReport report = checkService.check(host, port);
                gui.getGUIThread().invokeLater(() -> {
                    resultLabel.setText(report.success() ? "OK" : "FAIL");
                    showReport(gui, report, host, port);
                });
            }, "pin-check-worker");
            worker.setDaemon(true);
            worker.start();
        }));
        actions.addComponent(new Button("Close", dialog::close));

        Panel wrapper = new Panel(new LinearLayout(Direction.VERTICAL));
        wrapper.addComponent(request.withBorder(Borders.singleLine("Request")));
        wrapper.addComponent(actions);
        wrapper.addComponent(resultLabel.withBorder(Borders.singleLine("Status")));

        dialog.setComponent(wrapper);
        gui.addWindowAndWait(dialog);
    }

    private static Integer parsePort(String host, String portText, Label resultLabel) {
        if (host == null || host.isBlank()) {
            resultLabel.setText("Host is required");
            return null;
        }
        try {
            int port = Integer.parseInt(portText);
            if (port < 1 || port > 65535) {
                resultLabel.setText("Port must be between 1 and 65535");
                return null;
            }
            return port;
        } catch (NumberFormatException ex) {
            resultLabel.setText("Port must be a valid number");
            return null;
        }
    }

    private static void showReport(MultiWindowTextGUI gui, PinCheckReport report, String host, int port) {
        BasicWindow dialog = Dialogs.modal("Pin check result");

        StringBuilder summary = new StringBuilder();
        summary.append(report.success() ? "OK\n" : "FAIL\n");
        summary.append(report.message()).append('\n');
        if (report.outcome() != null) {
            summary.append("Decision: ").append(report.outcome().describe()).append('\n');
        }
        summary.append("Client certificate supplied: ").append(report.clientCertificateSupplied() ? "yes" : "no").append('\n');
        report.rootCertificate().ifPresent(root -> summary
            .append("\nRoot: ").append(root.subjectDn()).append('\n')
            .append(root.thumbprintAlgorithm().digestName()).append(": ").append(root.thumbprintHex()).append('\n'));

        Panel root = new Panel(new LinearLayout(Direction.VERTICAL));
        root.addComponent(new Label(summary.toString()).withBorder(Borders.singleLine(host + ":" + port)));

        Panel actions = new Panel(new LinearLayout(Direction.HORIZONTAL));
        Table<String> table = null;
        if (report.peerChain().isEmpty()) {
            root.addComponent(new Label("Server presented no certificates."));
        } else {
            table = new Table<>("#", "Subject CN", "Issuer CN", "Not after");
            table.setPreferredSize(new TerminalSize(96, 8));
            for (CertificateModel cert : report.peerChain()) {
                table.getTableModel().addRow(
                    String.valueOf(cert.chainIndex()),
                    cert.subjectCn(),
                    cert.issuerCn(),
                    DATE_FORMATTER.format(cert.notAfter())
                );
            }
            table.setSelectedRow(0);
            Table<String> chainTable = table;
            table.setSelectAction(() -> openSelected(gui, chainTable, report));
            root.addComponent(table.withBorder(Borders.singleLine("Presented chain")));
            actions.addComponent(new Button("View details", () -> openSelected(gui, chainTable, report)));
        }
        report.rootCertificate()
            .filter(rootCert -> !report.peerChain().contains(rootCert))
            .ifPresent(rootCert -> actions.addComponent(
                new Button("View root", () -> CertificateDetailsDialog.show(gui, rootCert))
            ));
        actions.addComponent(new Button("Close", dialog::close));

        root.addComponent(actions);
        dialog.setComponent(root);
        if (table != null) {
            dialog.setFocusedInteractable(table);
        }
        gui.addWindowAndWait(dialog);
    }

    private static void openSelected(MultiWindowTextGUI gui, Table<String> table, PinCheckReport report) {
        int row = table.getSelectedRow();
        if (row < 0 || row >= report.peerChain().size()) {
            return;
        }
        CertificateDetailsDialog.show(gui, report.peerChain().get(row));
    }
}
