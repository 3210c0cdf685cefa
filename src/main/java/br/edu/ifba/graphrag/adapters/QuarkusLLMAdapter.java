package br.edu.ifba.graphrag.adapters;

import br.edu.ifba.graphrag.chat.ChatMessage;
import br.edu.ifba.graphrag.chat.LlmChatClient;
import br.edu.ifba.graphrag.chat.LlmChatRequest;
import br.edu.ifba.graphrag.chat.LlmChatResponse;
import br.edu.ifba.graphrag.llm.GenerationConfig;
import br.edu.ifba.graphrag.llm.LLMFunction;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jetbrains.annotations.NotNull;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter that exposes the Quarkus-managed {@link LlmChatClient} as an {@link LLMFunction}.
 *
 * <p>Each call runs on a bounded pool of daemon worker threads so the pipeline can stop
 * waiting at its timeout and cancel the call. The workers carry the application
 * classloader so the REST client can resolve its providers.</p>
 */
@ApplicationScoped
public class QuarkusLLMAdapter implements LLMFunction {

    private static final Logger LOG = Logger.getLogger(QuarkusLLMAdapter.class);
    private static final ClassLoader QUARKUS_CLASSLOADER = QuarkusLLMAdapter.class.getClassLoader();
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    static final int MAX_CONCURRENT_CALLS = 8;

    private static final ThreadFactory THREAD_FACTORY = task -> {
        final Thread thread = new Thread(() -> {
            Thread.currentThread().setContextClassLoader(QUARKUS_CLASSLOADER);
            task.run();
        }, "graphrag-llm-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    };

    private final ThreadPoolExecutor executor = newBoundedExecutor();

    @Inject
    @RestClient
    LlmChatClient chatClient;

    @Inject
    GenerationConfig config;

    /**
     * Starts one chat completion on a worker thread.
     *
     * <p>Cancelling the returned future interrupts the worker, which aborts the blocking
     * REST call. Calls beyond {@value #MAX_CONCURRENT_CALLS} wait in the queue.</p>
     */
    @Override
    public CompletableFuture<String> apply(
            @NotNull final String prompt,
            @NotNull final Map<String, Object> kwargs) {

        final CancellableCall call = new CancellableCall();
        call.attach(executor.submit(() -> {
            try {
                call.complete(complete(prompt, kwargs));
            } catch (Exception e) {
                call.completeExceptionally(e);
            }
        }));
        return call;
    }

    private String complete(final String prompt, final Map<String, Object> kwargs) {
        final Object modelParam = kwargs.get("model");
        final String model = modelParam instanceof String ? (String) modelParam : config.model();
        final Double temperature = getDoubleParam(kwargs, "temperature", config.temperature());
        final Integer maxTokens = getIntegerParam(kwargs, "max_tokens", config.maxTokens());

        LOG.debugf("Calling LLM with model: %s, temperature: %.2f, maxTokens: %d, prompt length: %d",
                model, temperature, maxTokens, Integer.valueOf(prompt.length()));

        final LlmChatRequest request = new LlmChatRequest(
                model,
                List.of(ChatMessage.user(prompt)),
                false,
                maxTokens,
                temperature
        );

        final LlmChatResponse response = chatClient.chat(request);
        if (response == null || response.choices() == null || response.choices().isEmpty()) {
            throw new IllegalStateException("LLM returned no choices in response");
        }

        final ChatMessage message = response.choices().get(0).message();
        final String content = message != null ? message.content() : null;
        if (content == null) {
            throw new IllegalStateException("LLM returned a choice without content");
        }

        final String tokenInfo = response.usage() != null
                ? String.valueOf(response.usage().totalTokens())
                : "unknown";
        LOG.debugf("LLM response received - length: %d characters, tokens: %s",
                Integer.valueOf(content.length()), tokenInfo);
        return content;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private static ThreadPoolExecutor newBoundedExecutor() {
        final ThreadPoolExecutor pool = new ThreadPoolExecutor(
                MAX_CONCURRENT_CALLS, MAX_CONCURRENT_CALLS,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                THREAD_FACTORY);
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    private Double getDoubleParam(final Map<String, Object> kwargs, final String key, final double defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private Integer getIntegerParam(final Map<String, Object> kwargs, final String key, final int defaultValue) {
        final Object value = kwargs.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    /**
     * Future handed to callers; cancelling it also cancels the submitted task.
     */
    private static final class CancellableCall extends CompletableFuture<String> {

        private volatile Future<?> task;

        void attach(final Future<?> submitted) {
            this.task = submitted;
            if (isCancelled()) {
                submitted.cancel(true);
            }
        }

        @Override
        public boolean cancel(final boolean mayInterruptIfRunning) {
            final boolean cancelled = super.cancel(mayInterruptIfRunning);
            final Future<?> submitted = task;
            if (cancelled && submitted != null) {
                submitted.cancel(true);
            }
            return cancelled;
        }
    }
}
