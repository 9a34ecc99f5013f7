package com.pointer.content;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Gear-hash content-defined chunker for UTF-8 text.
 *
 * <p>A cut is declared where the rolling gear hash has its top {@code log2(avg)} bits clear,
 * never before {@code minSize} bytes and never after {@code maxSize} bytes. The cut is then moved
 * forward to just after the next newline; if no newline exists before the hard limit it is moved
 * back to the nearest UTF-8 character boundary so every chunk decodes on its own.
 */
public class ContentDefinedChunker {
    public static final int DEFAULT_MIN_SIZE = 64 * 1024;
    public static final int DEFAULT_AVG_SIZE = 256 * 1024;
    public static final int DEFAULT_MAX_SIZE = 1024 * 1024;

    private static final long GEAR_SEED = 0x5EEDC0DE2F3A9B71L;
    private static final long[] GEAR = gearTable();

    private final int minSize;
    private final int avgSize;
    private final int maxSize;
    private final long mask;

    public ContentDefinedChunker() {
        this(DEFAULT_MIN_SIZE, DEFAULT_AVG_SIZE, DEFAULT_MAX_SIZE);
    }

    public ContentDefinedChunker(int minSize, int avgSize, int maxSize) {
        if (minSize <= 0 || avgSize < minSize || maxSize < avgSize) {
            throw new IllegalArgumentException("chunk sizes must satisfy 0 < min <= avg <= max");
        }
        this.minSize = minSize;
        this.avgSize = avgSize;
        this.maxSize = maxSize;
        int bits = 31 - Integer.numberOfLeadingZeros(avgSize);
        this.mask = bits == 0 ? 0L : ((1L << bits) - 1) << (64 - bits);
    }

    public List<ChunkRange> ranges(byte[] bytes) {
        List<ChunkRange> ranges = new ArrayList<>();
        int start = 0;
        while (start < bytes.length) {
            int end;
            if (bytes.length - start <= minSize) {
                end = bytes.length;
            } else {
                int limit = Math.min(bytes.length, start + maxSize);
                end = align(bytes, start, findCut(bytes, start, limit), limit);
            }
            ranges.add(new ChunkRange(start, end));
            start = end;
        }
        return ranges;
    }

    public int minSize() {
        return minSize;
    }

    public int avgSize() {
        return avgSize;
    }

    public int maxSize() {
        return maxSize;
    }

    private int findCut(byte[] bytes, int start, int limit) {
        long hash = 0L;
        for (int i = start + minSize; i < limit; i++) {
            hash = (hash << 1) + GEAR[bytes[i] & 0xFF];
            if ((hash & mask) == 0L) {
                return i + 1;
            }
        }
        return limit;
    }

    private int align(byte[] bytes, int start, int cut, int limit) {
        if (cut >= bytes.length) {
            return bytes.length;
        }
        if (bytes[cut - 1] == '\n') {
            return cut;
        }
        for (int i = cut; i < limit; i++) {
            if (bytes[i] == '\n') {
                return i + 1;
            }
        }
        if (limit >= bytes.length) {
            return bytes.length;
        }
        int boundary = limit;
        while (boundary > start + 1 && (bytes[boundary] & 0xC0) == 0x80) {
            boundary--;
        }
        return boundary;
    }

    private static long[] gearTable() {
        SplittableRandom random = new SplittableRandom(GEAR_SEED);
        long[] table = new long[256];
        for (int i = 0; i < table.length; i++) {
            table[i] = random.nextLong();
        }
        return table;
    }

    public record ChunkRange(int start, int end) {
        public int length() {
            return end - start;
        }
    }
}
