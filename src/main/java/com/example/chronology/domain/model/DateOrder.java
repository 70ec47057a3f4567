package com.example.chronology.domain.model;

/**
 * Field order used to read ambiguous numeric dates such as {@code 03.04.2020}.
 */
public enum DateOrder {
    DMY,
    MDY,
    YMD;

    /**
     * @return the order with day and month exchanged, used as a single retry
     */
    public DateOrder swapped() {
        return switch (this) {
            case DMY -> MDY;
            case MDY -> DMY;
            case YMD -> YMD;
        };
    }
}
