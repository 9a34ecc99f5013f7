package com.pointer.content;

public record PutResult(String contentHash, boolean created, boolean binary) {
}
