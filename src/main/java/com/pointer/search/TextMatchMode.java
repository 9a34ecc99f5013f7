package com.pointer.search;

public enum TextMatchMode {
    SUBSTRING,
    FULL_TEXT,
    NGRAM
}
