package com.example.storelab.query;

public enum Operator {
    EQ,
    GTE,
    LTE,
    /** Substring match ignoring case. The value is taken literally, never as a pattern. */
    CONTAINS_IGNORE_CASE
}
