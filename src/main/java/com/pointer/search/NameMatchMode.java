package com.pointer.search;

public enum NameMatchMode {
    EXACT,
    PREFIX,
    FUZZY
}
