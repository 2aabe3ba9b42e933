package pinning.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.function.Predicate;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

public final class TarGzExtractor {
    private TarGzExtractor() {
    }

    public static boolean looksLikeTarGz(String fileName, byte[] body) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".tar.gz") || name.endsWith(".tgz")) {
            return true;
        }
        return body != null
            && body.length >= 2
            && (body[0] & 0xFF) == 0x1F
            && (body[1] & 0xFF) == 0x8B;
    }

    public static byte[] extractSingleFile(byte[] tarGzBytes) throws IOException {
        return extractSingleFile(tarGzBytes, name -> true);
    }

    /**
     * Returns the only regular file whose name is accepted by {@code nameFilter}; other files are skipped.
     */
    public static byte[] extractSingleFile(byte[] tarGzBytes, Predicate<String> nameFilter) throws IOException {
        try (
            ByteArrayInputStream bais = new ByteArrayInputStream(tarGzBytes);
            GzipCompressorInputStream gzipIn = new GzipCompressorInputStream(bais);
            TarArchiveInputStream tarIn = new TarArchiveInputStream(gzipIn)
        ) {
            TarArchiveEntry entry;
            int matches = 0;
            byte[] extracted = null;
            while ((entry = tarIn.getNextEntry()) != null) {
                if (entry.isDirectory() || !nameFilter.test(entry.getName())) {
                    continue;
                }
                matches++;
                if (matches > 1) {
                    throw new IOException("tar.gz must contain exactly one matching file, found another: " + entry.getName());
                }
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                tarIn.transferTo(out);
                extracted = out.toByteArray();
            }
            if (matches != 1 || extracted == null) {
                throw new IOException("tar.gz must contain exactly one matching file");
            }
            return extracted;
        }
    }
}
