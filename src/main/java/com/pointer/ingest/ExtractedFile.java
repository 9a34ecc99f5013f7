package com.pointer.ingest;

import java.nio.charset.StandardCharsets;
import java.util.List;

public record ExtractedFile(
        String repository,
        String commit,
        String path,
        String language,
        byte[] content,
        List<ExtractedSymbol> symbols) {

    public ExtractedFile {
        if (repository == null || repository.isBlank()) {
            throw new IllegalArgumentException("repository must not be blank");
        }
        if (commit == null || commit.isBlank()) {
            throw new IllegalArgumentException("commit must not be blank");
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        content = content == null ? new byte[0] : content;
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }

    public static ExtractedFile text(String repository, String commit, String path, String language, String text,
                                     List<ExtractedSymbol> symbols) {
        return new ExtractedFile(repository, commit, path, language, text.getBytes(StandardCharsets.UTF_8), symbols);
    }
}
