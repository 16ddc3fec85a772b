package com.shopsense.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Month;
import java.util.Optional;

/**
 * Calendar seasons used for product attributes and seasonal boosting.
 * March-May is spring, June-August summer, September-November fall, the rest winter.
 */
public enum Season {
    SPRING,
    SUMMER,
    FALL,
    WINTER;

    public static Season of(Month month) {
        return switch (month) {
            case MARCH, APRIL, MAY -> SPRING;
            case JUNE, JULY, AUGUST -> SUMMER;
            case SEPTEMBER, OCTOBER, NOVEMBER -> FALL;
            default -> WINTER;
        };
    }

    /**
     * Lenient lookup for free-form attribute values ("Summer", " fall ").
     */
    public static Optional<Season> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase();
        if ("AUTUMN".equals(normalized)) {
            return Optional.of(FALL);
        }
        for (Season season : values()) {
            if (season.name().equals(normalized)) {
                return Optional.of(season);
            }
        }
        return Optional.empty();
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
