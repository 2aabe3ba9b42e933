package pinning.cert;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ThumbprintAlgorithmTest {

    @Test
    public void defaultsToSha1() {
        assertEquals(ThumbprintAlgorithm.SHA1, ThumbprintAlgorithm.parse(null));
        assertEquals(ThumbprintAlgorithm.SHA1, ThumbprintAlgorithm.parse(" "));
    }

    @Test
    public void acceptsDigestAndEnumSpellings() {
        assertEquals(ThumbprintAlgorithm.SHA1, ThumbprintAlgorithm.parse("SHA-1"));
        assertEquals(ThumbprintAlgorithm.SHA256, ThumbprintAlgorithm.parse("sha-256"));
        assertEquals(ThumbprintAlgorithm.SHA256, ThumbprintAlgorithm.parse("SHA256"));
    }

    @Test
    public void rejectsUnknownAlgorithms() {
        assertThrows(IllegalArgumentException.class, () -> ThumbprintAlgorithm.parse("MD5"));
    }
}
