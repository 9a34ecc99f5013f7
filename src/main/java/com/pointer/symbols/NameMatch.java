package com.pointer.symbols;

import java.util.Set;

public record NameMatch(String nameLowercase, String displayName, Set<String> contentHashes, double similarity) {
}
