package br.edu.ifba.meetingrag.ingestion;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.jetbrains.annotations.Nullable;

/**
 * HMAC-SHA256 verification of webhook bodies.
 *
 * <p>Without a configured secret every request is accepted. With one, the signature header
 * is required and must carry the HMAC of the raw body, hex or base64 encoded, optionally
 * prefixed with {@code sha256=}. Comparison is constant-time.</p>
 */
public class WebhookVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    @Nullable
    private final SecretKeySpec key;

    public WebhookVerifier(@Nullable String secret) {
        this.key = secret == null || secret.isBlank()
            ? null
            : new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public boolean isEnabled() {
        return key != null;
    }

    /**
     * @throws WebhookAuthenticationException if a secret is configured and the signature is missing or wrong
     */
    public void verify(byte[] body, @Nullable String signatureHeader) {
        if (key == null) {
            return;
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookAuthenticationException("Missing webhook signature");
        }
        byte[] provided = decode(signatureHeader.trim());
        if (provided == null || !MessageDigest.isEqual(sign(body), provided)) {
            throw new WebhookAuthenticationException("Invalid webhook signature");
        }
    }

    /**
     * Hex-encoded HMAC of {@code body}.
     */
    public String signHex(byte[] body) {
        if (key == null) {
            throw new IllegalStateException("No webhook secret configured");
        }
        return HexFormat.of().formatHex(sign(body));
    }

    private byte[] sign(byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(body);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    @Nullable
    private static byte[] decode(String signature) {
        String value = signature.toLowerCase(Locale.ROOT).startsWith(PREFIX)
            ? signature.substring(PREFIX.length())
            : signature;
        if (value.length() == 64 && value.chars().allMatch(WebhookVerifier::isHexDigit)) {
            return HexFormat.of().parseHex(value);
        }
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
