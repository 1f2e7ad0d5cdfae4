package com.fxfeed.domain.model;

import lombok.Value;

/**
 * Currency - identified by its 3-letter code (e.g. "USD")
 * Value object - equal iff codes match exactly (case-sensitive)
 */
@Value
public class Currency {
    String code;

    public Currency(String code) {
        if (code == null || code.isEmpty()) {
            throw new IllegalArgumentException("Currency code cannot be null or empty");
        }
        this.code = code;
    }

    @Override
    public String toString() {
        return code;
    }
}
