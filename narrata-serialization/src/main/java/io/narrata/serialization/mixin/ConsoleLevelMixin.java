package io.narrata.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonValue;

/// Writes {@link io.narrata.core.state.ConsoleLevel} as `info`, `warning` or `error`.
public abstract class ConsoleLevelMixin {

    @JsonValue
    abstract String id();
}
