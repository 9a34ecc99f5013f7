package com.pointer.ingest;

public record IngestionReport(int files, int newBlobs, int dedupedBlobs, int binaryFiles, int symbolsIndexed, int failed) {
}
