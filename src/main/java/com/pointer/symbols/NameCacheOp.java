package com.pointer.symbols;

import java.util.List;

public record NameCacheOp(Type type, String contentHash, List<String> names) {
    public enum Type {
        ATTACH,
        DETACH
    }

    public NameCacheOp {
        names = List.copyOf(names);
    }
}
