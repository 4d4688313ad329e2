package io.narrata.core.execution.executor;

import java.io.Serial;

public class NodeExecutorNotFound extends Exception {
    @Serial private static final long serialVersionUID = 8120455962233710458L;

    public NodeExecutorNotFound(String message) {
        super(message);
    }
}
