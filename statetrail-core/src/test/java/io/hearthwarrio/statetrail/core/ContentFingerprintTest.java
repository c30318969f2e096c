package io.hearthwarrio.statetrail.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ContentFingerprintTest {

    @Test
    void scriptsStylesAndWhitespaceDoNotChangeTheFingerprint() {
        String a = "<html><body><h1>Projects</h1>\n\n   <p>Alpha</p></body></html>";
        String b = "<html><body><SCRIPT type=\"module\">track(\n42)</SCRIPT><h1>Projects</h1> "
                + "<style>\nh1 { color: red }\n</style><p>Alpha</p></body></html>";

        assertEquals(ContentFingerprint.of(a), ContentFingerprint.of(b));
        assertEquals(
                ContentFingerprint.normalize("<p>x</p>   <p>y</p>"),
                ContentFingerprint.normalize("  <p>x</p>\n\t<p>y</p>\n")
        );
    }

    @Test
    void visibleContentChangeChangesTheFingerprint() {
        assertNotEquals(
                ContentFingerprint.of("<ul><li>Alpha</li></ul>"),
                ContentFingerprint.of("<ul><li>Alpha</li><li>Beta</li></ul>")
        );
    }

    @Test
    void fingerprintIsLowerCaseSha256Hex() {
        // SHA-256 of the empty string
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", ContentFingerprint.of(null));
        assertTrue(ContentFingerprint.of("<p>x</p>").matches("[0-9a-f]{64}"));
    }
}
