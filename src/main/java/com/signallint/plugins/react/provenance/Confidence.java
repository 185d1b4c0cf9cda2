package com.signallint.plugins.react.provenance;

public enum Confidence {
    DEFINITE,
    HEURISTIC
}
