package com.pointer.gc;

public record GcReport(
        int candidates,
        int blobsDeleted,
        int symbolsDeleted,
        int nameRefsDetached,
        int namesRemoved,
        int chunksDeleted,
        int failures,
        boolean stopped) {
}
