package fr.lapetina.llm.orchestrator.infrastructure.provider.error;

import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import fr.lapetina.llm.orchestrator.domain.model.ProviderError;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw provider failures to the shared {@link ErrorKind} taxonomy.
 *
 * One implementation per provider error format.
 */
public interface ErrorClassifier {

    /**
     * Classifies an error response.
     *
     * @param provider   provider name
     * @param statusCode HTTP status; 200 for errors embedded in a stream
     * @param body       raw response body, possibly empty or not JSON
     */
    ProviderError classify(String provider, int statusCode, String body);

    /**
     * Classifies a transport-level failure.
     */
    default ProviderError classify(String provider, Throwable failure) {
        return classifyFailure(provider, failure);
    }

    /**
     * Provider-independent classification of a thrown failure.
     */
    static ProviderError classifyFailure(String provider, Throwable failure) {
        Throwable cause = ProviderException.unwrap(failure);
        if (cause instanceof ProviderException providerException) {
            return providerException.getError();
        }
        String message = cause.getClass().getName() + ": " + cause.getMessage();
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return ProviderError.of(ErrorKind.TIMEOUT, provider, message);
        }
        if (cause instanceof IOException) {
            return ProviderError.of(ErrorKind.SERVER_ERROR, provider, message);
        }
        return ProviderError.of(ErrorKind.UNKNOWN, provider, message);
    }

    /**
     * Fallback when the body carries no recognizable code.
     */
    static ErrorKind kindForStatus(int statusCode) {
        if (statusCode == 429) {
            return ErrorKind.RATE_LIMIT;
        }
        if (statusCode == 408 || statusCode == 504) {
            return ErrorKind.TIMEOUT;
        }
        if (statusCode == 402) {
            return ErrorKind.QUOTA_EXHAUSTED;
        }
        if (statusCode >= 500 && statusCode < 600) {
            return ErrorKind.SERVER_ERROR;
        }
        return ErrorKind.UNKNOWN;
    }
}
