package ai.tidal.llm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.tidal.config.TidalConfig;
import ai.tidal.events.EventBus;
import ai.tidal.events.EventType;
import ai.tidal.events.Payloads;
import ai.tidal.stream.StreamCoordinator;
import ai.tidal.testutil.RecordingSubscriber;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LlmStreamBridgeTest {
    private static final Duration IDLE = Duration.ofSeconds(5);

    private EventBus bus;
    private StreamCoordinator coordinator;
    private RecordingSubscriber recorder;

    private static final class CannedStreamingModel implements StreamingChatModel {
        private final List<String> tokens;

        CannedStreamingModel(List<String> tokens) {
            this.tokens = tokens;
        }

        @Override
        public void doChat(ChatRequest chatRequest, StreamingChatResponseHandler handler) {
            tokens.forEach(handler::onPartialResponse);
            var cr = ChatResponse.builder()
                    .aiMessage(new AiMessage(String.join("", tokens)))
                    .build();
            handler.onCompleteResponse(cr);
        }
    }

    private static final class FailingStreamingModel implements StreamingChatModel {
        @Override
        public void doChat(ChatRequest chatRequest, StreamingChatResponseHandler handler) {
            handler.onPartialResponse("I was about to");
            handler.onError(new IOException("connection reset", new IllegalStateException("socket closed")));
        }
    }

    private static ChatRequest request() {
        return ChatRequest.builder().messages(UserMessage.from("hello")).build();
    }

    @BeforeEach
    void setUp() {
        var config = TidalConfig.defaults().withCoalesceInterval(Duration.ofMillis(10));
        bus = new EventBus(config);
        coordinator = new StreamCoordinator(bus, config);
        coordinator.attach();
        recorder = RecordingSubscriber.attachedTo(bus, EventType.MESSAGE, EventType.ERROR, EventType.STREAM_END);
    }

    @AfterEach
    void tearDown() {
        coordinator.detach();
        bus.close();
    }

    @Test
    void partialResponsesBecomeOneFinalizedMessage() throws Exception {
        var result = LlmStreamBridge.stream(bus, new CannedStreamingModel(List.of("Hel", "lo", ", world")), request());

        assertEquals("Hello, world", result.get(5, TimeUnit.SECONDS));
        assertTrue(bus.awaitIdle(IDLE));
        assertEquals(List.of("Hello, world"), recorder.messageContents());
        var message = recorder.ofType(EventType.MESSAGE).get(0);
        assertEquals(Payloads.ROLE_ASSISTANT, message.getString(Payloads.ROLE));
    }

    @Test
    void providerErrorIsReportedAfterThePartialTurn() throws Exception {
        var result = LlmStreamBridge.stream(bus, new FailingStreamingModel(), request());

        var thrown = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, thrown.getCause());
        assertTrue(bus.awaitIdle(IDLE));

        assertEquals(List.of(EventType.STREAM_END, EventType.MESSAGE, EventType.ERROR), recorder.types());
        var error = recorder.ofType(EventType.ERROR).get(0);
        assertEquals("connection reset", error.getString(Payloads.MESSAGE));
        assertTrue(error.getString(Payloads.DETAILS, "").contains("socket closed"));
        assertEquals(List.of("I was about to"), recorder.messageContents());
    }

    @Test
    void reasoningIsKeptApartFromContent() throws Exception {
        var bridge = new LlmStreamBridge(bus, "r1", Payloads.ROLE_ASSISTANT);
        bridge.onReasoning("Consider the ");
        bridge.onReasoning("options.");
        bridge.onPartialResponse("Use B.");
        bridge.onCompleteResponse(ChatResponse.builder().aiMessage(new AiMessage("Use B.")).build());
        assertTrue(bus.awaitIdle(IDLE));

        var message = recorder.ofType(EventType.MESSAGE).get(0);
        assertEquals("Use B.", message.getString(Payloads.CONTENT));
        var metadata = message.getMap(Payloads.METADATA);
        assertEquals("r1", metadata.get(Payloads.STREAM_ID));
        assertEquals("Consider the options.", metadata.get(Payloads.REASONING));
        assertEquals("Use B.", bridge.completion().get(1, TimeUnit.SECONDS));
    }

    @Test
    void callbacksAfterCompletionAreIgnored() {
        var bridge = new LlmStreamBridge(bus);
        bridge.onPartialResponse("one");
        bridge.onCompleteResponse(ChatResponse.builder().aiMessage(new AiMessage("one")).build());
        bridge.onPartialResponse("late");
        bridge.onError(new IllegalStateException("late failure"));
        assertTrue(bus.awaitIdle(IDLE));

        assertEquals(List.of("one"), recorder.messageContents());
        assertTrue(recorder.ofType(EventType.ERROR).isEmpty());
    }
}
