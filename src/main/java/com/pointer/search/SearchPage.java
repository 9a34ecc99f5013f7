package com.pointer.search;

import java.util.List;

public record SearchPage(List<SearchHit> hits, int page, int pageSize, int total, boolean hasMore) {
}
