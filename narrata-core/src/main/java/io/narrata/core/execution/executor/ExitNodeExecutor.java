package io.narrata.core.execution.executor;

import io.narrata.core.flow.node.ExitNode;
import io.narrata.core.state.CallFrame;
import java.util.List;

/// Ends the current flow.
///
/// At the top level the session finishes. Inside a called flow control returns
/// to the caller, whichever node type made the call.
public class ExitNodeExecutor implements NodeExecutor<ExitNode> {

    @Override
    public Class<ExitNode> getNodeType() {
        return ExitNode.class;
    }

    @Override
    public Transition execute(ExitNode node, StepContext context) {
        List<CallFrame> callStack = context.getState().getCallStack();
        if (callStack.isEmpty()) {
            context.info(node, "Execution finished");
            return Transition.finish();
        }
        CallFrame caller = callStack.get(callStack.size() - 1);
        context.info(node, "Exit → returning to " + caller.flowName());
        return new Transition.ReturnToCaller();
    }
}
