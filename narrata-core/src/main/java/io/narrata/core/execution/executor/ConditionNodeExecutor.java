package io.narrata.core.execution.executor;

import io.narrata.core.evaluator.ConditionResult;
import io.narrata.core.evaluator.SwitchResult;
import io.narrata.core.expression.Rule;
import io.narrata.core.flow.Pins;
import io.narrata.core.flow.node.ConditionNode;
import io.narrata.core.state.ConsoleLevel;
import java.util.Optional;

/// Branches on the node's condition.
///
/// ### Boolean mode
/// Follows the `true` or `false` output. A false result is logged as a warning
/// so that failed checks stand out in the console.
///
/// ### Switch mode
/// Follows the output named after the first rule that holds. When no rule
/// holds, or the matched rule's output is not wired, the `default` output is
/// used; without one, execution stalls.
public class ConditionNodeExecutor implements NodeExecutor<ConditionNode> {

    @Override
    public Class<ConditionNode> getNodeType() {
        return ConditionNode.class;
    }

    @Override
    public Transition execute(ConditionNode node, StepContext context) {
        return node.isSwitchMode() ? executeSwitch(node, context) : executeBoolean(node, context);
    }

    private Transition executeBoolean(ConditionNode node, StepContext context) {
        ConditionResult result = context.evaluate(node.getCondition());
        context.log(
                node,
                result.passed() ? ConsoleLevel.INFO : ConsoleLevel.WARNING,
                "Condition → " + result.passed() + " (" + result.passedCount() + " of "
                        + result.details().size() + " rules passed)",
                result.details());
        if (result.hasUnresolved()) {
            context.warn(node, "Condition references unknown variables");
        }

        String pin = result.passed() ? Pins.TRUE : Pins.FALSE;
        Optional<String> target = context.targetOf(node, pin);
        if (target.isEmpty()) {
            return context.stall(node, "No connection on '" + pin + "' output");
        }
        return Transition.advance(target.get());
    }

    private Transition executeSwitch(ConditionNode node, StepContext context) {
        SwitchResult result = context.evaluateSwitch(node.getCondition());
        if (result.matched()) {
            Rule rule = result.matchedRule();
            context.log(
                    node,
                    ConsoleLevel.INFO,
                    "Switch → case \"" + rule.displayLabel() + "\" matched",
                    result.details());
            Optional<String> target = context.targetOf(node, rule.id());
            if (target.isPresent()) {
                return Transition.advance(target.get());
            }
            Optional<String> fallback = context.targetOf(node, Pins.DEFAULT);
            if (fallback.isPresent()) {
                context.warn(
                        node,
                        "Case \"" + rule.displayLabel() + "\" has no connection, following default");
                return Transition.advance(fallback.get());
            }
            return context.stall(
                    node, "Case \"" + rule.displayLabel() + "\" has no connection and no default");
        }

        Optional<String> fallback = context.targetOf(node, Pins.DEFAULT);
        if (fallback.isPresent()) {
            context.log(
                    node,
                    ConsoleLevel.INFO,
                    "Switch → no case matched, following default",
                    result.details());
            return Transition.advance(fallback.get());
        }
        context.log(
                node,
                ConsoleLevel.ERROR,
                "Switch → no case matched and no default output",
                result.details());
        return Transition.stall("No case matched");
    }
}
