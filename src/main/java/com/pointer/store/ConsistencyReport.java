package com.pointer.store;

import java.util.List;

import com.pointer.content.ContentStore;
import com.pointer.symbols.SymbolNameRef;

public record ConsistencyReport(
        List<ContentStore.RefCountMismatch> refCountMismatches,
        List<SymbolNameRef> orphanNameRefs,
        List<SymbolNameRef> missingNameRefs,
        List<String> orphanSymbolHashes,
        int blobsAwaitingGc) {

    public boolean consistent() {
        return refCountMismatches.isEmpty() && orphanNameRefs.isEmpty() && missingNameRefs.isEmpty() && orphanSymbolHashes.isEmpty();
    }
}
