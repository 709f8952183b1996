package com.omotes.protocol.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Wire form of an integer parameter. Every field is optional and its presence is tracked
 * explicitly: an absent {@code minimum} and a {@code minimum} of 0 are different messages.
 */
public final class IntegerParameterMessage {

    private final Long defaultValue;
    private final Long minimum;
    private final Long maximum;

    @JsonCreator
    public IntegerParameterMessage(
            @JsonProperty("default") Long defaultValue,
            @JsonProperty("minimum") Long minimum,
            @JsonProperty("maximum") Long maximum) {
        this.defaultValue = defaultValue;
        this.minimum = minimum;
        this.maximum = maximum;
    }

    @JsonProperty("default")
    public Long getDefaultValue() {
        return defaultValue;
    }

    @JsonProperty("minimum")
    public Long getMinimum() {
        return minimum;
    }

    @JsonProperty("maximum")
    public Long getMaximum() {
        return maximum;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public boolean hasMinimum() {
        return minimum != null;
    }

    public boolean hasMaximum() {
        return maximum != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntegerParameterMessage that = (IntegerParameterMessage) o;
        return Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(minimum, that.minimum)
                && Objects.equals(maximum, that.maximum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(defaultValue, minimum, maximum);
    }
}
