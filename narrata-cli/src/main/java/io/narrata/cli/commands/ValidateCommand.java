package io.narrata.cli.commands;

import io.narrata.cli.ui.AnsiStyles;
import io.narrata.core.NarrataEnvironment;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.FlowIssue;
import io.narrata.core.flow.FlowValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// CLI command for validating flow structure.
///
/// Checks every flow, or the named ones, for a missing entry node, dangling
/// connections, dead ends and unresolved jump targets.
///
/// ### Usage
/// ```bash
/// narrata validate [-d <working-dir>] [<flowId>...]
/// ```
///
/// Exits with `1` when a flow is missing or has an error-level issue.
@Command(name = "validate", description = "Validate flow structure")
class ValidateCommand extends ProjectCommand {

    @Parameters(arity = "0..*", description = "Flows to validate (default: all)")
    private List<String> flowIds;

    @Override
    protected int execute() {
        AnsiStyles styles = styles();
        try (NarrataEnvironment environment = openEnvironment()) {
            FlowValidator validator = environment.flowValidator();
            List<FlowGraph> flows;
            if (flowIds == null || flowIds.isEmpty()) {
                flows = environment.getFlowRepository().findAll();
            } else {
                flows = new ArrayList<>();
                for (String flowId : flowIds) {
                    Optional<FlowGraph> flow = environment.getFlowRepository().getFlowGraph(flowId);
                    if (flow.isEmpty()) {
                        System.err.printf("%s Flow not found: %s%n", styles.crossmark(), flowId);
                        return 1;
                    }
                    flows.add(flow.get());
                }
            }
            if (flows.isEmpty()) {
                System.out.println(" [WARN] No flows found in " + getWorkingDirectory());
                return 0;
            }

            boolean failed = false;
            for (FlowGraph flow : flows) {
                List<FlowIssue> issues = validator.validate(flow);
                boolean hasErrors =
                        issues.stream().anyMatch(i -> i.severity() == FlowIssue.Severity.ERROR);
                failed |= hasErrors;
                System.out.printf(
                        " %s %s (%s) - %d node(s), %d issue(s)%n",
                        hasErrors ? styles.error("[FAIL]") : styles.success("[OK]"),
                        styles.bold(flow.getName()),
                        flow.getId(),
                        flow.getNodes().size(),
                        issues.size());
                for (FlowIssue issue : issues) {
                    String where = issue.nodeId() != null ? issue.nodeId() + ": " : "";
                    System.out.printf(
                            "   %s %s%s%n",
                            styles.severity(issue.severity(), issue.severity().name().toLowerCase(Locale.ROOT)),
                            where,
                            issue.message());
                }
            }
            return failed ? 1 : 0;
        } catch (IllegalArgumentException e) {
            System.err.printf("%s Validation failed: %s%n", styles.crossmark(), e.getMessage());
            return 1;
        }
    }
}
