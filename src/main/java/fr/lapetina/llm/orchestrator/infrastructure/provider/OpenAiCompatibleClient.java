package fr.lapetina.llm.orchestrator.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.llm.orchestrator.domain.model.ChatRequest;
import fr.lapetina.llm.orchestrator.domain.model.ChatResult;
import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import fr.lapetina.llm.orchestrator.domain.model.ProviderError;
import fr.lapetina.llm.orchestrator.domain.model.TokenUsage;
import fr.lapetina.llm.orchestrator.infrastructure.provider.error.ErrorClassifier;
import fr.lapetina.llm.orchestrator.infrastructure.provider.error.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.StringJoiner;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Base client for providers exposing an OpenAI-compatible
 * {@code /chat/completions} endpoint.
 *
 * <p>Uses {@link java.net.http.HttpClient} for non-blocking I/O. Streams are
 * server-sent events: {@code data: {json}} lines terminated by
 * {@code data: [DONE]}, content at {@code choices[0].delta.content} and usage
 * in the final chunk. Subclasses supply the error classifier and may add
 * provider-specific body fields.
 */
public abstract class OpenAiCompatibleClient implements ProviderClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleClient.class);

    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final ProviderSettings settings;
    private final ErrorClassifier errorClassifier;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ExecutorService streamExecutor;

    protected OpenAiCompatibleClient(ProviderSettings settings, ErrorClassifier errorClassifier) {
        this.settings = settings;
        this.errorClassifier = errorClassifier;

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        AtomicInteger counter = new AtomicInteger();
        this.streamExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, settings.name() + "-stream-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String getName() {
        return settings.name();
    }

    public ProviderSettings getSettings() {
        return settings;
    }

    /**
     * Hook for provider-specific body fields.
     */
    protected void customizeBody(ObjectNode body, ChatRequest request, boolean stream) {
        // Plain OpenAI-compatible body by default
    }

    @Override
    public CompletableFuture<ChatResult> chat(ChatRequest request) {
        CompletableFuture<ChatResult> result = new CompletableFuture<>();
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, false);
        } catch (JsonProcessingException e) {
            result.completeExceptionally(new ProviderException(
                    ProviderError.of(ErrorKind.UNKNOWN, getName(), e.getMessage()), e));
            return result;
        }

        Instant startTime = Instant.now();
        log.info("Sending chat request: provider={}, model={}, endpoint={}",
                getName(), request.model(), httpRequest.uri());

        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .whenComplete((response, throwable) -> {
                    if (throwable != null) {
                        result.completeExceptionally(toProviderException(request, throwable));
                    } else {
                        completeChat(request, response, startTime, result);
                    }
                });
        armDeadline(result, request);
        return result;
    }

    @Override
    public CompletableFuture<TokenUsage> streamChat(ChatRequest request, DeltaListener listener) {
        CompletableFuture<TokenUsage> result = new CompletableFuture<>();
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request, true);
        } catch (JsonProcessingException e) {
            result.completeExceptionally(new ProviderException(
                    ProviderError.of(ErrorKind.UNKNOWN, getName(), e.getMessage()), e));
            return result;
        }

        log.info("Opening stream: provider={}, model={}, endpoint={}",
                getName(), request.model(), httpRequest.uri());

        CompletableFuture<HttpResponse<Stream<String>>> exchange =
                httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofLines());
        exchange.whenCompleteAsync((response, throwable) -> {
            if (throwable != null) {
                result.completeExceptionally(toProviderException(request, throwable));
            } else {
                readStream(request, response, listener, result);
            }
        }, streamExecutor);
        // Abandon the exchange if the deadline or a cancel wins before headers arrive
        result.whenComplete((usage, failure) -> {
            if (failure != null) {
                exchange.cancel(true);
            }
        });
        armDeadline(result, request);
        return result;
    }

    private HttpRequest buildHttpRequest(ChatRequest request, boolean stream) throws JsonProcessingException {
        return HttpRequest.newBuilder()
                .uri(settings.endpoint("chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + settings.apiKey())
                .header("Accept", stream ? "text/event-stream" : "application/json")
                .timeout(settings.callTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(request, stream)))
                .build();
    }

    String buildRequestBody(ChatRequest request, boolean stream) throws JsonProcessingException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.model());

        ArrayNode messages = body.putArray("messages");
        if (request.hasSystem()) {
            messages.addObject().put("role", "system").put("content", request.system());
        }
        messages.addObject().put("role", "user").put("content", request.prompt());

        body.put("temperature", request.temperature());
        body.put("max_tokens", request.maxTokens());
        body.put("stream", stream);
        if (stream) {
            body.putObject("stream_options").put("include_usage", true);
        }
        customizeBody(body, request, stream);
        return objectMapper.writeValueAsString(body);
    }

    private void completeChat(
            ChatRequest request,
            HttpResponse<String> response,
            Instant startTime,
            CompletableFuture<ChatResult> result
    ) {
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();

        if (statusCode < 200 || statusCode >= 300) {
            ProviderError error = errorClassifier.classify(getName(), statusCode, response.body());
            log.warn("Chat request failed: provider={}, model={}, status={}, kind={}, latencyMs={}",
                    getName(), request.model(), statusCode, error.kind(), latencyMs);
            result.completeExceptionally(new ProviderException(error));
            return;
        }

        try {
            JsonNode root = objectMapper.readTree(response.body());
            if (root.hasNonNull("error")) {
                result.completeExceptionally(new ProviderException(
                        errorClassifier.classify(getName(), statusCode, response.body())));
                return;
            }
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            TokenUsage usage = parseUsage(root.get("usage"));

            log.info("Chat request successful: provider={}, model={}, latencyMs={}, inputTokens={}, outputTokens={}",
                    getName(), request.model(), latencyMs, usage.inputTokens(), usage.outputTokens());
            result.complete(new ChatResult(content, usage));
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse chat response: provider={}, model={}", getName(), request.model());
            result.completeExceptionally(new ProviderException(
                    ProviderError.of(ErrorKind.SERVER_ERROR, getName(), "malformed response"), e));
        }
    }

    private void readStream(
            ChatRequest request,
            HttpResponse<Stream<String>> response,
            DeltaListener listener,
            CompletableFuture<TokenUsage> result
    ) {
        int statusCode = response.statusCode();
        try (Stream<String> lines = response.body()) {
            Iterator<String> iterator = lines.iterator();
            // Closing the body unblocks this reader when the deadline fires or the caller cancels
            result.whenComplete((usage, failure) -> lines.close());
            if (statusCode < 200 || statusCode >= 300) {
                StringJoiner joiner = new StringJoiner("\n");
                iterator.forEachRemaining(joiner::add);
                String body = joiner.toString();
                ProviderError error = errorClassifier.classify(getName(), statusCode, body);
                log.warn("Stream rejected: provider={}, model={}, status={}, kind={}",
                        getName(), request.model(), statusCode, error.kind());
                result.completeExceptionally(new ProviderException(error));
                return;
            }

            TokenUsage usage = TokenUsage.ZERO;
            while (iterator.hasNext()) {
                if (result.isDone()) {
                    // Deadline already fired; nothing more may reach the listener
                    return;
                }
                if (listener.isCancelled()) {
                    log.debug("Stream cancelled by listener: provider={}, model={}", getName(), request.model());
                    break;
                }
                String line = iterator.next();
                if (!line.startsWith(DATA_PREFIX)) {
                    continue;
                }
                String data = line.substring(DATA_PREFIX.length()).trim();
                if (data.isEmpty()) {
                    continue;
                }
                if (DONE_MARKER.equals(data)) {
                    break;
                }

                JsonNode chunk = objectMapper.readTree(data);
                if (chunk.hasNonNull("error")) {
                    ProviderError error = errorClassifier.classify(getName(), statusCode, data);
                    log.warn("Error inside stream: provider={}, model={}, kind={}",
                            getName(), request.model(), error.kind());
                    result.completeExceptionally(new ProviderException(error));
                    return;
                }
                String delta = chunk.path("choices").path(0).path("delta").path("content").asText("");
                if (!delta.isEmpty() && !result.isDone()) {
                    listener.onDelta(delta);
                }
                JsonNode usageNode = chunk.get("usage");
                if (usageNode != null && !usageNode.isNull()) {
                    usage = parseUsage(usageNode);
                }
            }

            log.debug("Stream finished: provider={}, model={}, inputTokens={}, outputTokens={}",
                    getName(), request.model(), usage.inputTokens(), usage.outputTokens());
            result.complete(usage);

        } catch (JsonProcessingException e) {
            log.warn("Malformed stream chunk: provider={}, model={}", getName(), request.model());
            result.completeExceptionally(new ProviderException(
                    ProviderError.of(ErrorKind.SERVER_ERROR, getName(), "malformed chunk"), e));
        } catch (UncheckedIOException e) {
            if (result.isDone()) {
                log.debug("Stream closed after completion: provider={}, model={}", getName(), request.model());
                return;
            }
            result.completeExceptionally(toProviderException(request, e.getCause()));
        }
    }

    private TokenUsage parseUsage(JsonNode usageNode) {
        if (usageNode == null || usageNode.isNull()) {
            return TokenUsage.ZERO;
        }
        return new TokenUsage(
                usageNode.path("prompt_tokens").asInt(0),
                usageNode.path("completion_tokens").asInt(0)
        );
    }

    private ProviderException toProviderException(ChatRequest request, Throwable throwable) {
        ProviderError error = errorClassifier.classify(getName(), throwable);
        Throwable cause = ProviderException.unwrap(throwable);
        if (error.kind() == ErrorKind.TIMEOUT) {
            log.error("Provider timeout: provider={}, model={}, error={}",
                    getName(), request.model(), cause.getMessage());
        } else {
            log.error("Provider connection error: provider={}, model={}, errorType={}, error={}",
                    getName(), request.model(), cause.getClass().getSimpleName(), cause.getMessage());
        }
        return cause instanceof ProviderException providerException
                ? providerException
                : new ProviderException(error, cause);
    }

    /**
     * Fails {@code result} with a classified timeout once the call deadline passes.
     */
    private void armDeadline(CompletableFuture<?> result, ChatRequest request) {
        long deadlineMs = settings.callTimeout().toMillis();
        CompletableFuture.delayedExecutor(deadlineMs, TimeUnit.MILLISECONDS).execute(() -> {
            if (result.completeExceptionally(new ProviderException(
                    ProviderError.of(ErrorKind.TIMEOUT, getName(), "deadline " + deadlineMs + "ms")))) {
                log.warn("Call deadline exceeded: provider={}, model={}, timeoutMs={}",
                        getName(), request.model(), deadlineMs);
            }
        });
    }

    @Override
    public void close() {
        streamExecutor.shutdownNow();
    }
}
