package io.narrata.core.execution.executor;

import io.narrata.core.flow.Pins;
import io.narrata.core.flow.node.HubNode;
import java.util.Optional;

/// Forwards to the first wired output in `out1`..`out4` order.
///
/// A hub has no routing rule of its own; the main output is used when none of
/// the numbered outputs is wired.
public class HubNodeExecutor implements NodeExecutor<HubNode> {

    @Override
    public Class<HubNode> getNodeType() {
        return HubNode.class;
    }

    @Override
    public Transition execute(HubNode node, StepContext context) {
        for (String pin : Pins.HUB_OUTPUTS) {
            Optional<String> target = context.targetOf(node, pin);
            if (target.isPresent()) {
                context.info(node, "Hub: pass through " + pin);
                return Transition.advance(target.get());
            }
        }
        context.info(node, "Hub: pass through");
        return context.followOutput(node);
    }
}
