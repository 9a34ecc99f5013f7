package com.pointer.ingest;

public record IngestResult(String contentHash, boolean created, boolean binary, int symbolsIndexed) {
}
