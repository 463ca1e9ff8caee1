package com.janus.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * One canonical server-sent event. A completed response is always the sequence
 * message_start, content_block_start, content_block_delta*, content_block_stop,
 * message_delta, message_stop.
 */
@Value
public class StreamEvent {

    public static final String MESSAGE_START = "message_start";
    public static final String CONTENT_BLOCK_START = "content_block_start";
    public static final String CONTENT_BLOCK_DELTA = "content_block_delta";
    public static final String CONTENT_BLOCK_STOP = "content_block_stop";
    public static final String MESSAGE_DELTA = "message_delta";
    public static final String MESSAGE_STOP = "message_stop";
    public static final String ERROR = "error";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    String event;
    ObjectNode data;

    /**
     * Render as a text/event-stream frame.
     */
    public String toFrame() {
        return "event: " + event + "\ndata: " + data + "\n\n";
    }

    public static StreamEvent messageStart(String messageId, String model) {
        ObjectNode data = typed(MESSAGE_START);
        ObjectNode message = data.putObject("message");
        message.put("id", messageId);
        message.put("type", "message");
        message.put("role", "assistant");
        message.putArray("content");
        message.put("model", model);
        message.putNull("stop_reason");
        message.putNull("stop_sequence");
        ObjectNode usage = message.putObject("usage");
        usage.put("input_tokens", 0);
        usage.put("output_tokens", 0);
        return new StreamEvent(MESSAGE_START, data);
    }

    public static StreamEvent contentBlockStart(int index) {
        ObjectNode data = typed(CONTENT_BLOCK_START);
        data.put("index", index);
        ObjectNode block = data.putObject("content_block");
        block.put("type", "text");
        block.put("text", "");
        return new StreamEvent(CONTENT_BLOCK_START, data);
    }

    public static StreamEvent textDelta(int index, String text) {
        ObjectNode data = typed(CONTENT_BLOCK_DELTA);
        data.put("index", index);
        ObjectNode delta = data.putObject("delta");
        delta.put("type", "text_delta");
        delta.put("text", text);
        return new StreamEvent(CONTENT_BLOCK_DELTA, data);
    }

    public static StreamEvent contentBlockStop(int index) {
        ObjectNode data = typed(CONTENT_BLOCK_STOP);
        data.put("index", index);
        return new StreamEvent(CONTENT_BLOCK_STOP, data);
    }

    public static StreamEvent messageDelta(String stopReason, int outputTokens) {
        ObjectNode data = typed(MESSAGE_DELTA);
        ObjectNode delta = data.putObject("delta");
        delta.put("stop_reason", stopReason);
        delta.putNull("stop_sequence");
        data.putObject("usage").put("output_tokens", outputTokens);
        return new StreamEvent(MESSAGE_DELTA, data);
    }

    public static StreamEvent messageStop() {
        return new StreamEvent(MESSAGE_STOP, typed(MESSAGE_STOP));
    }

    public static StreamEvent error(String errorType, String message) {
        ObjectNode data = typed(ERROR);
        ObjectNode error = data.putObject("error");
        error.put("type", errorType);
        error.put("message", message);
        return new StreamEvent(ERROR, data);
    }

    private static ObjectNode typed(String type) {
        ObjectNode node = NODES.objectNode();
        node.put("type", type);
        return node;
    }
}
