package pinning.util;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pinning.TestArchives;

@RunWith(JUnit4.class)
public class MaterialFilesTest {
    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void readsPlainFile() throws Exception {
        Path file = temporaryFolder.newFile("client.p12").toPath();
        Files.write(file, new byte[] {1, 2, 3});

        assertArrayEquals(new byte[] {1, 2, 3}, MaterialFiles.read(file, MaterialFiles.PKCS12_ENTRY));
    }

    @Test
    public void unpacksArchivedBundle() throws Exception {
        byte[] bundle = "bundle".getBytes(StandardCharsets.UTF_8);
        Path archive = temporaryFolder.newFile("client.tar.gz").toPath();
        Files.write(archive, TestArchives.tarGz(Map.of("client.p12", bundle)));

        assertArrayEquals(bundle, MaterialFiles.read(archive, MaterialFiles.PKCS12_ENTRY));
    }

    @Test
    public void rejectsMissingFilesAndDirectories() throws Exception {
        Path missing = temporaryFolder.getRoot().toPath().resolve("missing.p12");
        Path directory = temporaryFolder.newFolder("bundles").toPath();

        assertThrows(IOException.class, () -> MaterialFiles.read(missing, MaterialFiles.PKCS12_ENTRY));
        assertThrows(IOException.class, () -> MaterialFiles.read(directory, MaterialFiles.PKCS12_ENTRY));
    }
}
