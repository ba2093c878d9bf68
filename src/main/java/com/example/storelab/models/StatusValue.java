package com.example.storelab.models;

/**
 * Enumerations whose external form (JSON, database column, document field) is a lower-case
 * string instead of the constant name.
 */
public interface StatusValue {
    String value();
}
