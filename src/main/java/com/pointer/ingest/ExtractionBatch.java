package com.pointer.ingest;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

public record ExtractionBatch(String repository, String branch, String commit, Instant indexedAt, List<BatchFile> files) {

    public ExtractionBatch {
        files = files == null ? List.of() : files;
    }

    public List<ExtractedFile> toExtractedFiles() {
        List<ExtractedFile> extracted = new ArrayList<>(files.size());
        for (BatchFile file : files) {
            extracted.add(new ExtractedFile(repository, commit, file.path(), file.language(), file.bytes(), file.symbols()));
        }
        return extracted;
    }

    public record BatchFile(String path, String language, String content, String contentBase64, List<ExtractedSymbol> symbols) {
        byte[] bytes() {
            if (contentBase64 != null) {
                return Base64.getDecoder().decode(contentBase64);
            }
            return content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8);
        }
    }
}
