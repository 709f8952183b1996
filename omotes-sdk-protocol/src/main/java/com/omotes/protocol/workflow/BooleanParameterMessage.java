package com.omotes.protocol.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Wire form of a boolean parameter. */
public final class BooleanParameterMessage {

    private final Boolean defaultValue;

    @JsonCreator
    public BooleanParameterMessage(@JsonProperty("default") Boolean defaultValue) {
        this.defaultValue = defaultValue;
    }

    @JsonProperty("default")
    public Boolean getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(defaultValue, ((BooleanParameterMessage) o).defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(defaultValue);
    }
}
