package io.narrata.core.flow;

import java.io.Serial;

public class FlowNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 3172958834206159127L;

    public FlowNotFoundException(String message) {
        super(message);
    }
}
