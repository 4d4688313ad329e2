package io.narrata.cli.commands;

import io.narrata.core.NarrataConfig;
import io.narrata.core.NarrataEnvironment;
import io.narrata.core.autocomplete.Completion;
import io.narrata.core.variable.VariableStore;
import java.util.List;
import java.util.Locale;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// CLI command listing autocomplete candidates for a partial variable reference.
///
/// ### Usage
/// ```bash
/// narrata complete [-d <working-dir>] [-p <project>] [<prefix>]
/// ```
///
/// Prints one candidate per line as `apply  kind  detail`, best match first.
@Command(name = "complete", description = "List completions for a partial variable reference")
class CompleteCommand extends ProjectCommand {

    @Parameters(index = "0", arity = "0..1", description = "Text typed so far")
    private String prefix = "";

    @Override
    protected boolean showBanner() {
        return false;
    }

    @Override
    protected int execute() {
        NarrataConfig config = loadConfig();
        try (NarrataEnvironment environment = openEnvironment(config)) {
            VariableStore variables =
                    environment.getSheetRepository().buildInitialVariables(config.getProjectId());
            if (variables.isEmpty()) {
                System.err.println("No variables for project " + config.getProjectId());
                return 1;
            }
            List<Completion> completions =
                    environment.getCompletionSource().complete(prefix, variables);
            for (Completion completion : completions) {
                String kind = completion.kind().name().toLowerCase(Locale.ROOT);
                String detail = completion.detail() != null ? "  " + completion.detail() : "";
                System.out.println(completion.apply() + "  " + kind + detail);
            }
            return 0;
        }
    }
}
