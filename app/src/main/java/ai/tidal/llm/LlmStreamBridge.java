package ai.tidal.llm;

import ai.tidal.events.EventBus;
import ai.tidal.events.EventType;
import ai.tidal.events.Payloads;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Publishes one langchain4j streaming response as {@code stream_chunk} events under a single stream id.
 *
 * <p>Partial responses become content chunks, {@link #onReasoning(String)} becomes reasoning chunks, and completion
 * becomes an empty final chunk. A provider error is published as an {@code error} event, then the stream is closed
 * with a final chunk so the coordinator releases anything it queued.
 */
public final class LlmStreamBridge implements StreamingChatResponseHandler {
    private static final Logger logger = LogManager.getLogger(LlmStreamBridge.class);

    private final EventBus bus;
    private final String streamId;
    private final String role;
    private final AtomicBoolean done = new AtomicBoolean(false);
    private final CompletableFuture<String> completion = new CompletableFuture<>();

    public LlmStreamBridge(EventBus bus) {
        this(bus, UUID.randomUUID().toString(), Payloads.ROLE_ASSISTANT);
    }

    public LlmStreamBridge(EventBus bus, String streamId, String role) {
        this.bus = bus;
        this.streamId = streamId;
        this.role = role;
    }

    /**
     * Start a streaming request against {@code model}, bridged to {@code bus}.
     *
     * @return a future completing with the full response text, or exceptionally with the provider error
     */
    public static CompletableFuture<String> stream(EventBus bus, StreamingChatModel model, ChatRequest request) {
        var bridge = new LlmStreamBridge(bus);
        model.chat(request, bridge);
        return bridge.completion();
    }

    public String streamId() {
        return streamId;
    }

    public CompletableFuture<String> completion() {
        return completion;
    }

    @Override
    public void onPartialResponse(String partialResponse) {
        publishChunk(partialResponse, false, false);
    }

    /**
     * Reasoning ("thinking") tokens, for providers that surface them separately from the answer.
     */
    public void onReasoning(String partialReasoning) {
        publishChunk(partialReasoning, true, false);
    }

    @Override
    public void onCompleteResponse(ChatResponse completeResponse) {
        if (!done.compareAndSet(false, true)) {
            logger.warn("Ignoring completion for already finished stream {}", streamId);
            return;
        }
        publishChunk("", false, true);
        var text = completeResponse.aiMessage() == null ? "" : completeResponse.aiMessage().text();
        completion.complete(text == null ? "" : text);
    }

    @Override
    public void onError(Throwable error) {
        if (!done.compareAndSet(false, true)) {
            logger.warn("Ignoring error for already finished stream {}", streamId, error);
            return;
        }
        logger.error("LLM stream {} failed", streamId, error);
        bus.publishError(describe(error), detailsOf(error));
        publishChunk("", false, true);
        completion.completeExceptionally(error);
    }

    private void publishChunk(String text, boolean isReasoning, boolean isFinal) {
        if (done.get() && !isFinal) {
            logger.debug("Dropping late chunk for finished stream {}", streamId);
            return;
        }
        bus.publish(EventType.STREAM_CHUNK, Payloads.streamChunk(streamId, role, text, isReasoning, isFinal));
    }

    private static String describe(Throwable error) {
        var message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static @Nullable String detailsOf(Throwable error) {
        var cause = error.getCause();
        return cause == null ? null : cause.toString();
    }
}
