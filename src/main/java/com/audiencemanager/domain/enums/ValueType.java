package com.audiencemanager.domain.enums;

/** Literal type expected for a condition field's value. */
public enum ValueType {
    NUMBER,
    TEXT,
    DATE
}
