package com.pointer.store;

import java.time.Instant;
import java.util.List;

import com.pointer.content.ContentBlob;
import com.pointer.content.ManifestEntry;
import com.pointer.content.StoredChunk;
import com.pointer.ingest.FileRecord;
import com.pointer.retention.RetentionStore;
import com.pointer.symbols.SymbolName;
import com.pointer.symbols.SymbolNameRef;
import com.pointer.symbols.SymbolReference;

public record IndexState(
        int version,
        Instant savedAt,
        List<ContentBlob> blobs,
        List<ManifestEntry> manifest,
        List<StoredChunk> chunks,
        List<FileRecord> files,
        List<SymbolReference> symbolReferences,
        List<SymbolName> symbolNames,
        List<SymbolNameRef> symbolNameRefs,
        RetentionStore.RetentionRows retention) {

    public static final int CURRENT_VERSION = 1;

    public IndexState {
        blobs = blobs == null ? List.of() : blobs;
        manifest = manifest == null ? List.of() : manifest;
        chunks = chunks == null ? List.of() : chunks;
        files = files == null ? List.of() : files;
        symbolReferences = symbolReferences == null ? List.of() : symbolReferences;
        symbolNames = symbolNames == null ? List.of() : symbolNames;
        symbolNameRefs = symbolNameRefs == null ? List.of() : symbolNameRefs;
        retention = retention == null ? RetentionStore.RetentionRows.empty() : retention;
    }

    public static IndexState empty() {
        return new IndexState(CURRENT_VERSION, null, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                RetentionStore.RetentionRows.empty());
    }
}
