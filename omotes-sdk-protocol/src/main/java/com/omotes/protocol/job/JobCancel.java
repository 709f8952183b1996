package com.omotes.protocol.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Request to cancel a job. Published on the shared cancellation queue. */
public final class JobCancel {

    private final String uuid;

    @JsonCreator
    public JobCancel(@JsonProperty("uuid") String uuid) {
        this.uuid = uuid;
    }

    @JsonProperty("uuid")
    public String getUuid() {
        return uuid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(uuid, ((JobCancel) o).uuid);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(uuid);
    }
}
