package com.composeops.docker;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reassembles lines from log frames that may split or join lines arbitrarily.
 * <p>
 * Raw frames are decoded as UTF-8 with a stateful decoder, so a character whose bytes are split
 * across two frames is carried over instead of being replaced.
 */
final class LineBuffer {

    private final StringBuilder partial = new StringBuilder();

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    /** Trailing bytes of an incomplete character from the previous frame. */
    private ByteBuffer carry = ByteBuffer.allocate(0);

    /**
     * Appends raw UTF-8 bytes and returns the lines they completed.
     */
    List<String> append(byte[] bytes) {
        ByteBuffer in = ByteBuffer.allocate(carry.remaining() + bytes.length);
        in.put(carry).put(bytes).flip();
        CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
        decoder.decode(in, out, false);
        carry = ByteBuffer.allocate(in.remaining()).put(in).flip();
        return append(out.flip().toString());
    }

    /**
     * Appends text and returns the lines it completed, without terminators.
     */
    List<String> append(String text) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                int end = partial.length();
                if (end > 0 && partial.charAt(end - 1) == '\r') {
                    partial.setLength(end - 1);
                }
                lines.add(partial.toString());
                partial.setLength(0);
            } else {
                partial.append(c);
            }
        }
        return lines;
    }

    /**
     * Returns the unterminated remainder, if any, and clears it. Undecodable trailing bytes
     * become a replacement character.
     */
    List<String> flush() {
        if (carry.hasRemaining()) {
            CharBuffer out = CharBuffer.allocate(carry.remaining() + 2);
            decoder.decode(carry, out, true);
            decoder.flush(out);
            partial.append(out.flip());
            carry = ByteBuffer.allocate(0);
        }
        decoder.reset();
        if (partial.length() == 0) {
            return List.of();
        }
        String rest = partial.toString();
        partial.setLength(0);
        return List.of(rest);
    }
}
