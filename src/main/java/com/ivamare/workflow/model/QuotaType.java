package com.ivamare.workflow.model;

import java.time.Duration;

/**
 * Well-known quota types and their accounting windows.
 *
 * <p>Quota types are stored as plain strings so services may define their own;
 * the suffix ({@code _minute} / {@code _day}) decides how resets are estimated.
 */
public enum QuotaType {
    TOKENS_PER_MINUTE("tokens_per_minute", Duration.ofMinutes(1)),
    TOKENS_PER_DAY("tokens_per_day", Duration.ofDays(1)),
    REQUESTS_PER_MINUTE("requests_per_minute", Duration.ofMinutes(1)),
    REQUESTS_PER_DAY("requests_per_day", Duration.ofDays(1));

    private final String value;
    private final Duration window;

    QuotaType(String value, Duration window) {
        this.value = value;
        this.window = window;
    }

    public String getValue() {
        return value;
    }

    public Duration getWindow() {
        return window;
    }

    public static QuotaType fromValue(String value) {
        for (QuotaType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown QuotaType: " + value);
    }
}
