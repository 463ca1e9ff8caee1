package com.janus.transpiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.janus.model.StopReason;
import com.janus.model.StreamEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates one upstream SSE stream into canonical stream events.
 *
 * <p>State moves {@code CREATED -> OPEN -> CLOSED}. {@link #start()} opens the message before any
 * upstream byte is read, every text fragment becomes a delta at block index 0, and the first
 * finish signal closes the message. Frames arriving after that are parsed but produce nothing.
 * Instances are single-use and not thread-safe; Reactor delivers the chunks serially.</p>
 */
@Slf4j
public abstract class StreamTranslator {

    private static final int BLOCK_INDEX = 0;

    public enum State {
        CREATED,
        OPEN,
        CLOSED
    }

    private final ObjectMapper objectMapper;
    private final String model;
    private final String messageId = TranspilerSupport.newMessageId();
    private final SseLineBuffer lines = new SseLineBuffer();
    private State state = State.CREATED;

    protected StreamTranslator(ObjectMapper objectMapper, String model) {
        this.objectMapper = objectMapper;
        this.model = model;
    }

    /**
     * Translate a whole upstream body. Cancelling the result cancels the upstream subscription.
     * An upstream failure after the message was closed ends the stream normally.
     */
    public Flux<StreamEvent> translate(Flux<byte[]> upstream) {
        return Flux.concat(
                Flux.defer(() -> Flux.fromIterable(start())),
                upstream.concatMapIterable(this::advance)
                        .onErrorResume(e -> {
                            if (state != State.CLOSED) {
                                return Flux.error(e);
                            }
                            log.warn("Upstream failed after message {} completed: {}", messageId, e.getMessage());
                            return Flux.empty();
                        }),
                Flux.defer(() -> Flux.fromIterable(finish())));
    }

    public List<StreamEvent> start() {
        List<StreamEvent> out = new ArrayList<>();
        if (state == State.CREATED) {
            out.add(StreamEvent.messageStart(messageId, model));
            out.add(StreamEvent.contentBlockStart(BLOCK_INDEX));
            state = State.OPEN;
        }
        return out;
    }

    public List<StreamEvent> advance(byte[] chunk) {
        List<StreamEvent> out = start();
        for (String line : lines.append(chunk)) {
            processLine(line, out);
        }
        return out;
    }

    /**
     * Flush the trailing line and close a stream that ended without a finish signal.
     */
    public List<StreamEvent> finish() {
        List<StreamEvent> out = start();
        String trailing = lines.drain();
        if (trailing != null) {
            processLine(trailing, out);
        }
        if (state == State.OPEN) {
            log.debug("Upstream stream ended without finish reason, closing message {}", messageId);
            close(StopReason.END_TURN, 0, out);
        }
        return out;
    }

    public State getState() {
        return state;
    }

    private void processLine(String line, List<StreamEvent> out) {
        if (line.isBlank() || line.startsWith(":") || !line.startsWith("data:")) {
            return;
        }
        String payload = line.substring("data:".length()).trim();
        if (payload.isEmpty() || "[DONE]".equals(payload)) {
            return;
        }

        JsonNode chunk;
        try {
            chunk = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse upstream SSE chunk: {}", e.getOriginalMessage());
            return;
        }
        onChunk(chunk, out);
    }

    /**
     * Interpret one parsed upstream frame.
     */
    protected abstract void onChunk(JsonNode chunk, List<StreamEvent> out);

    protected void emitText(String text, List<StreamEvent> out) {
        if (state == State.OPEN && text != null && !text.isEmpty()) {
            out.add(StreamEvent.textDelta(BLOCK_INDEX, text));
        }
    }

    protected void close(String stopReason, int outputTokens, List<StreamEvent> out) {
        if (state != State.OPEN) {
            return;
        }
        out.add(StreamEvent.contentBlockStop(BLOCK_INDEX));
        out.add(StreamEvent.messageDelta(stopReason, outputTokens));
        out.add(StreamEvent.messageStop());
        state = State.CLOSED;
    }

    protected String getModel() {
        return model;
    }
}
