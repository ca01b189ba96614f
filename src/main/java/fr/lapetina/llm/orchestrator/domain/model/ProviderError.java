package fr.lapetina.llm.orchestrator.domain.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A classified provider failure.
 *
 * <p>Only the digest of the raw provider message is kept, so the original
 * text can be correlated in provider dashboards without ever being forwarded.
 */
public record ProviderError(
        ErrorKind kind,
        boolean retryable,
        String provider,
        String code,
        String digest
) {
    private static final int DIGEST_LENGTH = 16;

    public ProviderError {
        Objects.requireNonNull(kind, "Error kind is required");
        Objects.requireNonNull(provider, "Provider is required");
        if (digest == null) {
            digest = digestOf("");
        }
    }

    /**
     * Creates an error with the retry flag taken from the kind.
     */
    public static ProviderError of(ErrorKind kind, String provider, String code, String rawMessage) {
        return new ProviderError(kind, kind.isRetryable(), provider, code, digestOf(rawMessage));
    }

    public static ProviderError of(ErrorKind kind, String provider, String rawMessage) {
        return of(kind, provider, null, rawMessage);
    }

    public String messageKey() {
        return kind.getMessageKey();
    }

    static String digestOf(String rawMessage) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest((rawMessage != null ? rawMessage : "").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DIGEST_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
