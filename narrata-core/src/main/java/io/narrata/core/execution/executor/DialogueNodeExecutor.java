package io.narrata.core.execution.executor;

import io.narrata.core.evaluator.AssignmentOutcome;
import io.narrata.core.evaluator.ConditionResult;
import io.narrata.core.flow.node.DialogueNode;
import io.narrata.core.flow.node.Response;
import io.narrata.core.state.ConsoleLevel;
import io.narrata.core.state.PendingChoice;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Shows a dialogue line and offers its responses.
///
/// Every response is listed in the pending choices with its condition result,
/// so unavailable responses can be shown greyed out. The session waits for
/// input when at least one response is available. Otherwise the node behaves
/// like a plain line: it follows its output, or ends the branch when it has none.
public class DialogueNodeExecutor implements NodeExecutor<DialogueNode> {

    @Override
    public Class<DialogueNode> getNodeType() {
        return DialogueNode.class;
    }

    @Override
    public Transition execute(DialogueNode node, StepContext context) {
        String line = node.getSpeaker() != null
                ? node.getSpeaker() + ": " + node.getLabel()
                : node.getLabel();
        context.info(node, "Dialogue → " + line);

        if (!node.getInputCondition().isEmpty()) {
            ConditionResult input = context.evaluate(node.getInputCondition());
            if (!input.passed()) {
                context.log(
                        node,
                        ConsoleLevel.WARNING,
                        "Input condition not met (" + input.passedCount() + " of "
                                + input.details().size() + " rules passed)",
                        input.details());
            }
        }

        if (!node.getOutputInstruction().isEmpty()) {
            AssignmentOutcome outcome =
                    context.applyAssignments(node, node.getOutputInstruction());
            if (outcome.hasChanges()) {
                context.info(
                        node, "Output instruction → " + StepContext.describeChanges(outcome.changes()));
            }
        }

        List<PendingChoice> choices = new ArrayList<>();
        for (Response response : node.getResponses()) {
            ConditionResult result = context.evaluate(response.condition());
            choices.add(
                    new PendingChoice(response.id(), response.text(), result.passed(),
                            result.details()));
        }
        long available = choices.stream().filter(PendingChoice::valid).count();
        if (available > 0) {
            context.info(
                    node,
                    "Waiting for response (" + available + " of " + choices.size()
                            + " available)");
            return new Transition.AwaitChoice(choices);
        }
        if (!choices.isEmpty()) {
            context.warn(node, "No response is available");
        }

        Optional<String> target = context.outputTarget(node);
        if (target.isPresent()) {
            return Transition.advance(target.get());
        }
        context.info(node, "End of branch");
        return Transition.finish();
    }
}
