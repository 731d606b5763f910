package com.sitemirror.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PageStatus {
    SUCCESS,
    FAILED;

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }
}
