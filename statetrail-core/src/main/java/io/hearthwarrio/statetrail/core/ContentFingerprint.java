package io.hearthwarrio.statetrail.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Fingerprint of page markup used to tell visually or structurally distinct states apart.
 * <p>
 * Script and style bodies are dropped (they churn without changing what is shown) and whitespace
 * runs are collapsed before hashing with SHA-256.
 */
public final class ContentFingerprint {

    private static final Pattern SCRIPT = Pattern.compile(
            "<script[^>]*>.*?</script>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern STYLE = Pattern.compile(
            "<style[^>]*>.*?</style>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ContentFingerprint() {
        // utility class
    }

    public static String normalize(String markup) {
        String html = Texts.safe(markup);
        html = SCRIPT.matcher(html).replaceAll("");
        html = STYLE.matcher(html).replaceAll("");
        return WHITESPACE.matcher(html.strip()).replaceAll(" ");
    }

    /**
     * @param markup raw page source (null is treated as empty)
     * @return lower-case hex SHA-256 of the normalized markup
     */
    public static String of(String markup) {
        byte[] digest = sha256().digest(normalize(markup).getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(digest);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
