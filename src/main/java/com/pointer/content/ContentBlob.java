package com.pointer.content;

public record ContentBlob(String hash, String language, boolean binary, long byteLength, int lineCount) {
}
