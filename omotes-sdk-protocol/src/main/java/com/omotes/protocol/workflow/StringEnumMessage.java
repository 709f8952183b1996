package com.omotes.protocol.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** One selectable value of a string parameter: technical key and display label. */
public final class StringEnumMessage {

    private final String keyName;
    private final String displayName;

    @JsonCreator
    public StringEnumMessage(
            @JsonProperty("key_name") String keyName,
            @JsonProperty("display_name") String displayName) {
        this.keyName = keyName;
        this.displayName = displayName;
    }

    @JsonProperty("key_name")
    public String getKeyName() {
        return keyName;
    }

    @JsonProperty("display_name")
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StringEnumMessage that = (StringEnumMessage) o;
        return Objects.equals(keyName, that.keyName) && Objects.equals(displayName, that.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyName, displayName);
    }
}
