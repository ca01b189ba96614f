package fr.lapetina.llm.orchestrator.infrastructure.provider.error;

import fr.lapetina.llm.orchestrator.domain.model.ProviderError;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Thrown (or used to fail a future) when a provider call fails.
 *
 * The message carries only the classified kind, the provider code and the
 * digest of the raw text.
 */
public final class ProviderException extends RuntimeException {

    private final ProviderError error;

    public ProviderException(ProviderError error) {
        super("Provider error: kind=" + error.kind()
                + ", provider=" + error.provider()
                + ", code=" + error.code()
                + ", digest=" + error.digest());
        this.error = Objects.requireNonNull(error);
    }

    public ProviderException(ProviderError error, Throwable cause) {
        this(error);
        initCause(cause);
    }

    public ProviderError getError() {
        return error;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
