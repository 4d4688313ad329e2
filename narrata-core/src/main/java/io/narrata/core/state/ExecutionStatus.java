package io.narrata.core.state;

import java.util.Locale;

public enum ExecutionStatus {
    PAUSED,
    RUNNING,
    WAITING_INPUT,
    FINISHED;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
