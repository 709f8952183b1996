package com.omotes.workflow.parameter;

import java.util.Objects;

/** One choice of a multiple-choice string parameter: the submitted key and its display label. */
public final class StringEnumOption {

    private final String keyName;
    private final String displayName;

    public StringEnumOption(String keyName, String displayName) {
        this.keyName = Objects.requireNonNull(keyName, "keyName");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
    }

    public String getKeyName() {
        return keyName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StringEnumOption that = (StringEnumOption) o;
        return keyName.equals(that.keyName) && displayName.equals(that.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyName, displayName);
    }

    @Override
    public String toString() {
        return keyName + "=" + displayName;
    }
}
