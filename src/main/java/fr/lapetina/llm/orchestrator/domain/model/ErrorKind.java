package fr.lapetina.llm.orchestrator.domain.model;

/**
 * Closed taxonomy of provider failures.
 * Each kind carries its retry semantics and a stable message key that is
 * safe to forward to callers in place of the raw provider text.
 */
public enum ErrorKind {
    /** Provider throttled the call (HTTP 429 or a provider throttling code) */
    RATE_LIMIT(true, "error.rate_limit"),

    /** Prompt or output rejected by provider moderation; the user should rephrase */
    CONTENT_FILTER(false, "error.content_filter"),

    /** Call exceeded its deadline */
    TIMEOUT(true, "error.timeout"),

    /** Account quota or balance exhausted; needs operator attention */
    QUOTA_EXHAUSTED(false, "error.quota_exhausted"),

    /** Provider-side failure (5xx, overload) */
    SERVER_ERROR(true, "error.server_error"),

    /** Anything unrecognized. Not retried */
    UNKNOWN(false, "error.unknown");

    private final boolean retryable;
    private final String messageKey;

    ErrorKind(boolean retryable, String messageKey) {
        this.retryable = retryable;
        this.messageKey = messageKey;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getMessageKey() {
        return messageKey;
    }
}
