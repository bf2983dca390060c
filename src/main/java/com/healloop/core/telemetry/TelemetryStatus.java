package com.healloop.core.telemetry;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TelemetryStatus {
    SUCCESS,
    ERROR,
    EXCEPTION;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
