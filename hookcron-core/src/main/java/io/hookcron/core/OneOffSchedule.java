package io.hookcron.core;

import java.time.Instant;
import java.util.Objects;

public record OneOffSchedule(String timezone, Instant executeAt) implements Schedule {

    public OneOffSchedule {
        Objects.requireNonNull(executeAt, "executeAt must not be null");
    }

    @Override
    public JobKind kind() {
        return JobKind.ONE_OFF;
    }
}
