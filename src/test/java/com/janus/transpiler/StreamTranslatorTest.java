package com.janus.transpiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.janus.config.JacksonConfiguration;
import com.janus.model.StreamEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamTranslator line handling and lifecycle.
 */
class StreamTranslatorTest {

    private static final String BODY =
            "data: {\"choices\":[{\"delta\":{\"content\":\"Grüße, \"}}]}\n\n"
                    + "data: {\"choices\":[{\"delta\":{\"content\":\"世界 🌍\"}}]}\n\n"
                    + "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}],"
                    + "\"usage\":{\"completion_tokens\":9}}\n\n"
                    + "data: [DONE]\n\n";

    private ObjectMapper objectMapper;
    private OpenAiTranspiler transpiler;

    @BeforeEach
    void setUp() {
        objectMapper = JacksonConfiguration.createObjectMapper();
        transpiler = new OpenAiTranspiler(objectMapper);
    }

    /**
     * Event names with their text or stop reason, leaving out the random message id.
     */
    private static List<String> describe(List<StreamEvent> events) {
        List<String> described = new ArrayList<>();
        for (StreamEvent event : events) {
            String detail = switch (event.getEvent()) {
                case StreamEvent.CONTENT_BLOCK_DELTA -> event.getData().path("delta").path("text").asText();
                case StreamEvent.MESSAGE_DELTA -> event.getData().path("delta").path("stop_reason").asText()
                        + "/" + event.getData().path("usage").path("output_tokens").asInt();
                default -> "";
            };
            described.add(event.getEvent() + ":" + detail);
        }
        return described;
    }

    private List<StreamEvent> translate(byte[]... chunks) {
        return transpiler.newStreamTranslator("gpt-4o")
                .translate(Flux.fromIterable(Arrays.asList(chunks)))
                .collectList()
                .block();
    }

    @Test
    void testSplitAtAnyOffsetYieldsSameEvents() {
        byte[] bytes = BODY.getBytes(StandardCharsets.UTF_8);
        List<String> expected = describe(translate(bytes));

        assertEquals(List.of(
                "message_start:", "content_block_start:",
                "content_block_delta:Grüße, ", "content_block_delta:世界 🌍",
                "content_block_stop:", "message_delta:end_turn/9", "message_stop:"), expected);

        for (int offset = 1; offset < bytes.length; offset++) {
            byte[] head = Arrays.copyOfRange(bytes, 0, offset);
            byte[] tail = Arrays.copyOfRange(bytes, offset, bytes.length);
            assertEquals(expected, describe(translate(head, tail)), "split at byte " + offset);
        }
    }

    @Test
    void testByteByByteDelivery() {
        byte[] bytes = BODY.getBytes(StandardCharsets.UTF_8);
        byte[][] single = new byte[bytes.length][];
        for (int i = 0; i < bytes.length; i++) {
            single[i] = new byte[]{bytes[i]};
        }

        assertEquals(describe(translate(bytes)), describe(translate(single)));
    }

    @Test
    void testStartIsEmittedBeforeAnyUpstreamByte() {
        StreamTranslator translator = transpiler.newStreamTranslator("gpt-4o");

        List<StreamEvent> opening = translator.start();

        assertEquals(List.of("message_start", "content_block_start"),
                opening.stream().map(StreamEvent::getEvent).toList());
        assertEquals(StreamTranslator.State.OPEN, translator.getState());
        assertTrue(translator.start().isEmpty());
    }

    @Test
    void testStreamWithoutFinishReasonIsClosedOnCompletion() {
        List<StreamEvent> events = translate(
                "data: {\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}\n\n".getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of("message_start:", "content_block_start:", "content_block_delta:partial",
                "content_block_stop:", "message_delta:end_turn/0", "message_stop:"), describe(events));
    }

    @Test
    void testUnterminatedFinalLineIsFlushed() {
        List<StreamEvent> events = translate(
                "data: {\"choices\":[{\"delta\":{\"content\":\"x\"},\"finish_reason\":\"length\"}]}"
                        .getBytes(StandardCharsets.UTF_8));

        assertEquals("message_delta:max_tokens/0", describe(events).get(4));
    }

    @Test
    void testFramesAfterCloseProduceNothing() {
        List<StreamEvent> events = translate((
                "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}\n\n"
                        + "data: {\"choices\":[{\"delta\":{\"content\":\"late\"},\"finish_reason\":\"stop\"}]}\n\n")
                .getBytes(StandardCharsets.UTF_8));

        assertEquals(5, events.size());
        assertEquals("message_stop", events.get(4).getEvent());
    }

    @Test
    void testFailureAfterCloseEndsStreamNormally() {
        Flux<byte[]> upstream = Flux.concat(
                Flux.just(BODY.getBytes(StandardCharsets.UTF_8)),
                Flux.error(new IllegalStateException("reset after done")));

        List<StreamEvent> events = transpiler.newStreamTranslator("gpt-4o")
                .translate(upstream)
                .collectList()
                .block();

        assertNotNull(events);
        assertEquals("message_stop", events.get(events.size() - 1).getEvent());
        assertEquals(1, events.stream().filter(e -> e.getEvent().equals("message_stop")).count());
    }

    @Test
    void testFailureBeforeCloseIsPropagated() {
        Flux<byte[]> upstream = Flux.concat(
                Flux.just("data: {\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}\n\n"
                        .getBytes(StandardCharsets.UTF_8)),
                Flux.error(new IllegalStateException("connection reset")));
        StreamTranslator translator = transpiler.newStreamTranslator("gpt-4o");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> translator.translate(upstream).collectList().block());

        assertEquals("connection reset", error.getMessage());
        assertEquals(StreamTranslator.State.OPEN, translator.getState());
    }

    @Test
    void testEmptyUpstreamStillProducesCompleteMessage() {
        List<StreamEvent> events = translate();

        assertEquals(List.of("message_start", "content_block_start", "content_block_stop",
                "message_delta", "message_stop"), events.stream().map(StreamEvent::getEvent).toList());
    }

    @Test
    void testFrameRendering() {
        StreamEvent stop = StreamEvent.messageStop();

        assertEquals("event: message_stop\ndata: {\"type\":\"message_stop\"}\n\n", stop.toFrame());
    }
}
