package io.narrata.core.state;

import java.util.Locale;

public enum ConsoleLevel {
    INFO,
    WARNING,
    ERROR;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
