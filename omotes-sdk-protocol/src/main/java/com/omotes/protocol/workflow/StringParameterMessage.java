package com.omotes.protocol.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** Wire form of a string parameter: optional default and optional ordered enum options. */
public final class StringParameterMessage {

    private final String defaultValue;
    private final List<StringEnumMessage> enumOptions;

    @JsonCreator
    public StringParameterMessage(
            @JsonProperty("default") String defaultValue,
            @JsonProperty("enum_options") List<StringEnumMessage> enumOptions) {
        this.defaultValue = defaultValue;
        this.enumOptions = enumOptions != null ? List.copyOf(enumOptions) : List.of();
    }

    @JsonProperty("default")
    public String getDefaultValue() {
        return defaultValue;
    }

    @JsonProperty("enum_options")
    public List<StringEnumMessage> getEnumOptions() {
        return enumOptions;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StringParameterMessage that = (StringParameterMessage) o;
        return Objects.equals(defaultValue, that.defaultValue) && Objects.equals(enumOptions, that.enumOptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(defaultValue, enumOptions);
    }
}
