package fr.lapetina.llm.orchestrator.integration;

import fr.lapetina.llm.orchestrator.domain.model.ChatRequest;
import fr.lapetina.llm.orchestrator.domain.model.ChatResult;
import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import fr.lapetina.llm.orchestrator.domain.model.ProviderError;
import fr.lapetina.llm.orchestrator.domain.model.TokenUsage;
import fr.lapetina.llm.orchestrator.infrastructure.provider.DeltaListener;
import fr.lapetina.llm.orchestrator.infrastructure.provider.ProviderClient;
import fr.lapetina.llm.orchestrator.infrastructure.provider.error.ProviderException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provider client replaying scripted streams, keyed by physical model id.
 * Models without a script stream a single line naming themselves.
 */
public final class ScriptedProviderClient implements ProviderClient {

    private final String name;
    private final Map<String, Script> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<ChatRequest> requests = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "scripted-provider");
        t.setDaemon(true);
        return t;
    });

    public ScriptedProviderClient(String name) {
        this.name = name;
    }

    public ScriptedProviderClient script(String physicalModel, Script script) {
        scripts.put(physicalModel, script);
        return this;
    }

    public int callCount(String physicalModel) {
        AtomicInteger count = calls.get(physicalModel);
        return count != null ? count.get() : 0;
    }

    public List<ChatRequest> getRequests() {
        return requests;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CompletableFuture<ChatResult> chat(ChatRequest request) {
        StringBuilder content = new StringBuilder();
        return streamChat(request, content::append)
                .thenApply(usage -> new ChatResult(content.toString(), usage));
    }

    @Override
    public CompletableFuture<TokenUsage> streamChat(ChatRequest request, DeltaListener listener) {
        requests.add(request);
        int attempt = calls.computeIfAbsent(request.model(), k -> new AtomicInteger()).incrementAndGet();
        Script script = scripts.getOrDefault(request.model(), Script.lines(request.model() + " answer"));

        CompletableFuture<TokenUsage> result = new CompletableFuture<>();
        executor.execute(() -> {
            if (attempt <= script.failures) {
                result.completeExceptionally(new ProviderException(
                        ProviderError.of(script.failureKind, name, "scripted", "scripted failure")));
                return;
            }
            for (String delta : script.deltas) {
                if (listener.isCancelled()) {
                    break;
                }
                listener.onDelta(delta);
                if (script.delayMs > 0) {
                    try {
                        Thread.sleep(script.delayMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        result.completeExceptionally(e);
                        return;
                    }
                }
            }
            result.complete(new TokenUsage(10, script.deltas.size()));
        });
        return result;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Scripted behaviour of one physical model.
     */
    public static final class Script {
        private final List<String> deltas;
        private long delayMs;
        private int failures;
        private ErrorKind failureKind = ErrorKind.SERVER_ERROR;

        private Script(List<String> deltas) {
            this.deltas = deltas;
        }

        /**
         * Streams each line, newline-terminated, as its own delta.
         */
        public static Script lines(String... lines) {
            List<String> deltas = new ArrayList<>();
            for (String line : lines) {
                deltas.add(line + "\n");
            }
            return new Script(deltas);
        }

        public static Script deltas(String... deltas) {
            return new Script(List.of(deltas));
        }

        public static Script alwaysFailing(ErrorKind kind) {
            return new Script(List.of()).failing(kind, Integer.MAX_VALUE);
        }

        public Script withDelay(long delayMs) {
            this.delayMs = delayMs;
            return this;
        }

        /**
         * Fails the first {@code times} attempts before streaming.
         */
        public Script failing(ErrorKind kind, int times) {
            this.failureKind = kind;
            this.failures = times;
            return this;
        }
    }
}
