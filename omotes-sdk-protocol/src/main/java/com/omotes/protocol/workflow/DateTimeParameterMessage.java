package com.omotes.protocol.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Wire form of a datetime parameter. The default is an ISO-8601 local date-time string. */
public final class DateTimeParameterMessage {

    private final String defaultValue;

    @JsonCreator
    public DateTimeParameterMessage(@JsonProperty("default") String defaultValue) {
        this.defaultValue = defaultValue;
    }

    @JsonProperty("default")
    public String getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(defaultValue, ((DateTimeParameterMessage) o).defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(defaultValue);
    }
}
