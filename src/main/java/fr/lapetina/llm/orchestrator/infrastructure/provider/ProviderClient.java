package fr.lapetina.llm.orchestrator.infrastructure.provider;

import fr.lapetina.llm.orchestrator.domain.model.ChatRequest;
import fr.lapetina.llm.orchestrator.domain.model.ChatResult;
import fr.lapetina.llm.orchestrator.domain.model.TokenUsage;

import java.util.concurrent.CompletableFuture;

/**
 * Uniform chat-completion capability over one provider.
 *
 * <p>Returned futures fail only with
 * {@link fr.lapetina.llm.orchestrator.infrastructure.provider.error.ProviderException},
 * already classified; callers never see provider-specific payloads.
 */
public interface ProviderClient extends AutoCloseable {

    /**
     * Provider name as referenced by model bindings.
     */
    String getName();

    /**
     * Non-streaming call.
     */
    CompletableFuture<ChatResult> chat(ChatRequest request);

    /**
     * Streaming call. Deltas are pushed to {@code listener} in receipt order; the
     * returned future completes with the usage event that terminates the stream.
     * If the listener reports cancellation the stream is closed and the future
     * completes with the usage seen so far. Cancelling or timing out the
     * returned future closes the connection, even while no chunk arrives.
     */
    CompletableFuture<TokenUsage> streamChat(ChatRequest request, DeltaListener listener);

    @Override
    default void close() {
        // Nothing to release by default
    }
}
