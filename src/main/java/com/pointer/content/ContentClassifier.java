package com.pointer.content;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public final class ContentClassifier {
    private ContentClassifier() {
    }

    public static Classification classify(byte[] bytes) {
        for (byte b : bytes) {
            if (b == 0) {
                return new Classification(true, null, lineCount(bytes, 0, bytes.length));
            }
        }
        String text = decodeStrict(bytes, 0, bytes.length);
        if (text == null) {
            return new Classification(true, null, lineCount(bytes, 0, bytes.length));
        }
        return new Classification(false, text, lineCount(bytes, 0, bytes.length));
    }

    public static String decodeStrict(byte[] bytes, int offset, int length) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, offset, length)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    public static int lineCount(byte[] bytes, int offset, int length) {
        if (length == 0) {
            return 0;
        }
        int breaks = 0;
        for (int i = offset; i < offset + length; i++) {
            if (bytes[i] == '\n') {
                breaks++;
            }
        }
        return breaks + 1;
    }

    public record Classification(boolean binary, String text, int lineCount) {
    }
}
