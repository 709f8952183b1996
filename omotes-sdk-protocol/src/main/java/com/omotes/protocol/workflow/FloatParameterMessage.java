package com.omotes.protocol.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Wire form of a float parameter. Every field is optional and its presence is tracked
 * explicitly: an absent {@code minimum} and a {@code minimum} of 0 are different messages.
 */
public final class FloatParameterMessage {

    private final Double defaultValue;
    private final Double minimum;
    private final Double maximum;

    @JsonCreator
    public FloatParameterMessage(
            @JsonProperty("default") Double defaultValue,
            @JsonProperty("minimum") Double minimum,
            @JsonProperty("maximum") Double maximum) {
        this.defaultValue = defaultValue;
        this.minimum = minimum;
        this.maximum = maximum;
    }

    @JsonProperty("default")
    public Double getDefaultValue() {
        return defaultValue;
    }

    @JsonProperty("minimum")
    public Double getMinimum() {
        return minimum;
    }

    @JsonProperty("maximum")
    public Double getMaximum() {
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
        FloatParameterMessage that = (FloatParameterMessage) o;
        return Objects.equals(defaultValue, that.defaultValue)
                && Objects.equals(minimum, that.minimum)
                && Objects.equals(maximum, that.maximum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(defaultValue, minimum, maximum);
    }
}
