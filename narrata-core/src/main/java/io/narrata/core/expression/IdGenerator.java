package io.narrata.core.expression;

import java.util.UUID;

/// Generates `prefix_<random>` identifiers for rules and assignments.
public final class IdGenerator {

    private IdGenerator() {}

    public static String next(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
