package io.narrata.cli.commands;

import io.narrata.cli.ui.AnsiStyles;
import io.narrata.core.NarrataConfig;
import io.narrata.core.NarrataEnvironment;
import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.AssignmentParseResult;
import io.narrata.core.expression.ConditionParseResult;
import io.narrata.core.expression.ExpressionParser;
import io.narrata.core.expression.ExpressionSerializer;
import io.narrata.core.expression.ParseError;
import io.narrata.core.expression.Rule;
import io.narrata.core.expression.ValueType;
import io.narrata.core.variable.VariableStore;
import java.util.List;
import java.util.function.Supplier;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command for parsing instruction or condition text.
///
/// Prints the structured assignments or rules, the normalized text and every
/// syntax error with a caret under the offending range. References are split
/// against the project's declared variables when a sheet file exists.
///
/// ### Usage
/// ```bash
/// narrata parse [-d <working-dir>] [-p <project>] [--condition] "<text>"
/// ```
///
/// Exits with `1` when the text has syntax errors.
@Command(name = "parse", description = "Parse instruction or condition text")
class ParseCommand extends ProjectCommand {

    @Parameters(index = "0", description = "Expression text")
    private String text;

    @Option(
            names = {"-c", "--condition"},
            description = "Parse as a condition instead of an instruction")
    private boolean condition = false;

    @Override
    protected boolean showBanner() {
        return false;
    }

    @Override
    protected int execute() {
        AnsiStyles styles = styles();
        NarrataConfig config = loadConfig();
        try (NarrataEnvironment environment = openEnvironment(config)) {
            VariableStore known =
                    environment.getSheetRepository().buildInitialVariables(config.getProjectId());
            ExpressionParser parser = environment.getExpressionParser();
            ExpressionSerializer serializer = environment.getExpressionSerializer();
            VariableStore knownOrNull = known.isEmpty() ? null : known;

            if (condition) {
                ConditionParseResult result = parser.parseCondition(text, knownOrNull);
                List<Rule> rules = result.condition().rules();
                System.out.printf(
                        "%s %d rule(s), logic %s%n",
                        styles.bold("Condition:"), rules.size(), result.condition().logic().id());
                for (int i = 0; i < rules.size(); i++) {
                    Rule rule = rules.get(i);
                    System.out.printf(
                            "  %d. %s %s%s%n",
                            i + 1,
                            rule.reference(),
                            rule.operator().id(),
                            operand(rule.value(), rule.valueType(), rule.valueReference()));
                }
                return finish(styles, result.errors(),
                        () -> serializer.serializeCondition(result.condition()));
            }

            AssignmentParseResult result = parser.parseAssignments(text, knownOrNull);
            List<Assignment> assignments = result.assignments();
            System.out.printf("%s %d assignment(s)%n", styles.bold("Instruction:"), assignments.size());
            for (int i = 0; i < assignments.size(); i++) {
                Assignment assignment = assignments.get(i);
                System.out.printf(
                        "  %d. %s %s%s%n",
                        i + 1,
                        assignment.reference(),
                        assignment.operator().id(),
                        operand(assignment.value(), assignment.valueType(),
                                assignment.valueReference()));
            }
            return finish(styles, result.errors(),
                    () -> serializer.serializeAssignments(result.assignments()));
        }
    }

    private int finish(
            AnsiStyles styles, List<ParseError> errors, Supplier<String> normalized) {
        if (errors.isEmpty()) {
            System.out.printf("%s %s%n", styles.checkmark(), "Normalized: " + normalized.get());
            return 0;
        }
        System.err.printf("%s %d syntax error(s)%n", styles.crossmark(), errors.size());
        for (ParseError error : errors) {
            System.err.println("  " + text);
            System.err.println("  " + caret(error) + " " + styles.error(error.message()));
        }
        return 1;
    }

    private static String operand(String value, ValueType valueType, String reference) {
        if (valueType == ValueType.VARIABLE_REF) {
            return " ref " + reference;
        }
        return value != null ? " " + value : "";
    }

    private static String caret(ParseError error) {
        int width = Math.max(1, error.to() - error.from());
        return " ".repeat(Math.max(0, error.from())) + "^".repeat(width);
    }
}
