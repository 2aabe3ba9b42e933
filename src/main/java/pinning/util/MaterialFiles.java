package pinning.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Reads key and trust material from disk, unpacking single-file tar.gz archives.
 */
public final class MaterialFiles {
    public static final Predicate<String> PKCS12_ENTRY = name -> {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".p12") || lower.endsWith(".pfx");
    };

    private MaterialFiles() {
    }

    public static byte[] read(Path path, Predicate<String> archiveEntryFilter) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("File is not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Path is not a file: " + path);
        }
        byte[] bytes = Files.readAllBytes(path);
        String fileName = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        if (TarGzExtractor.looksLikeTarGz(fileName, bytes)) {
            return TarGzExtractor.extractSingleFile(bytes, archiveEntryFilter);
        }
        return bytes;
    }
}
