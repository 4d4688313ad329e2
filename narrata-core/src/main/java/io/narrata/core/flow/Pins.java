package io.narrata.core.flow;

import java.util.List;

/// Well-known pin names.
public final class Pins {

    public static final String INPUT = "input";
    public static final String DEFAULT = "default";
    public static final String OUTPUT = "output";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final List<String> HUB_OUTPUTS = List.of("out1", "out2", "out3", "out4");

    private static final String RESPONSE_PREFIX = "resp_";

    private Pins() {}

    /// Returns the alternative pin name a response output may be wired to.
    public static String responsePin(String responseId) {
        return RESPONSE_PREFIX + responseId;
    }
}
