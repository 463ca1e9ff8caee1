package com.janus.transpiler;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits an upstream byte stream into lines. Bytes after the last newline are held back, so a
 * multi-byte character or a JSON payload split across reads is only decoded once complete.
 */
class SseLineBuffer {

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    List<String> append(byte[] bytes) {
        List<String> lines = new ArrayList<>();
        for (byte b : bytes) {
            if (b == '\n') {
                lines.add(decode(pending.toByteArray()));
                pending.reset();
            } else {
                pending.write(b);
            }
        }
        return lines;
    }

    /**
     * @return the unterminated trailing line, or null if nothing is pending
     */
    String drain() {
        if (pending.size() == 0) {
            return null;
        }
        String line = decode(pending.toByteArray());
        pending.reset();
        return line;
    }

    private static String decode(byte[] bytes) {
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }
}
