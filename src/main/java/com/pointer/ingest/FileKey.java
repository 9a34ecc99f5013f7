package com.pointer.ingest;

public record FileKey(String repository, String commit, String path) {
}
