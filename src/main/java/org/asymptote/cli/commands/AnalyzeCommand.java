package org.asymptote.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.asymptote.cli.CommandLineInterface;
import org.asymptote.compiler.analysis.RoutineAnalysis;
import org.asymptote.compiler.analysis.complexity.Complexity;
import org.asymptote.compiler.api.AnalysisContext;
import org.asymptote.compiler.api.AnalysisException;
import org.asymptote.compiler.api.AnalysisOptions;
import org.asymptote.compiler.api.ResourceBudget;
import org.asymptote.compiler.diagnostics.Diagnostic;
import org.asymptote.export.ReportJsonWriter;
import org.asymptote.pipeline.AnalysisReport;
import org.asymptote.pipeline.ComplexityPipeline;
import org.asymptote.validation.BoundComparison;
import org.asymptote.validation.ComparisonResult;
import org.asymptote.validation.ValidationCollaborator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "analyze",
    description = "Analyzes a pseudocode file and prints its O, Omega and Theta bounds"
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzeCommand.class);

    /**
     * Output formats.
     */
    public enum OutputFormat {
        TEXT,
        JSON
    }

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--file"}, required = true, description = "The pseudocode file to analyze.")
    private File file;

    @Option(names = "--format", defaultValue = "TEXT",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private OutputFormat format;

    @Option(names = "--include-ast", description = "Include the annotated AST in JSON output.")
    private boolean includeAst;

    @Option(names = "--max-tokens", description = "Override the token budget.")
    private Integer maxTokens;

    @Option(names = "--max-depth", description = "Override the nesting depth budget.")
    private Integer maxDepth;

    @Option(names = "--expect-o", description = "Expected upper bound, compared against the result.")
    private String expectedUpper;

    @Option(names = "--expect-omega", description = "Expected lower bound, compared against the result.")
    private String expectedLower;

    @Option(names = "--expect-theta", description = "Expected tight bound, compared against the result.")
    private String expectedTight;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Config config;
        try {
            config = parent.getConfig().getConfig("asymptote");
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        final String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: Cannot read " + file.getPath() + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        final ValidationCollaborator validator = ExpectationValidator.anyGiven(expectedUpper, expectedLower, expectedTight)
                ? new ExpectationValidator(expectedUpper, expectedLower, expectedTight)
                : null;
        final ComplexityPipeline pipeline = ComplexityPipeline.fromConfig(config, validator);

        final AnalysisReport report;
        try {
            report = pipeline.analyze(source, AnalysisContext.start(options(config)));
        } catch (AnalysisException e) {
            err.println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_ANALYSIS_FAILED;
        }

        LOG.info("Analyzed {} ({} tokens): {}, {} diagnostic(s)",
                file.getName(), report.tokenCount(), report.complexity(), report.diagnostics().size());

        if (format == OutputFormat.JSON) {
            out.println(new ReportJsonWriter().toJson(report, includeAst));
        } else {
            printText(out, report);
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }

    private AnalysisOptions options(Config config) {
        AnalysisOptions options = config.hasPath("analysis")
                ? AnalysisOptions.fromConfig(config.getConfig("analysis"))
                : AnalysisOptions.DEFAULT;
        ResourceBudget budget = options.budget();
        if (maxTokens != null) {
            budget = budget.withMaxTokens(maxTokens);
        }
        if (maxDepth != null) {
            budget = budget.withMaxDepth(maxDepth);
        }
        return options.withBudget(budget);
    }

    private static void printText(PrintWriter out, AnalysisReport report) {
        Complexity complexity = report.complexity();
        out.println("O:     " + complexity.upperLabel());
        out.println("Omega: " + complexity.lowerLabel());
        out.println("Theta: " + complexity.thetaLabel());

        if (!report.result().routines().isEmpty()) {
            out.println();
            out.println("Routines:");
            for (RoutineAnalysis routine : report.result().routines()) {
                StringBuilder line = new StringBuilder("  ")
                        .append(routine.name()).append(": ").append(routine.complexity());
                routine.recurrenceDescriptor().ifPresent(r -> line.append("  [").append(r.render()).append(']'));
                routine.recurrenceSolution().ifPresent(s -> line.append("  ").append(s.recurrenceCase()));
                out.println(line);
            }
        }

        if (!report.diagnostics().isEmpty()) {
            out.println();
            out.println("Diagnostics:");
            for (Diagnostic diagnostic : report.diagnostics()) {
                out.println("  " + diagnostic);
            }
        }

        report.algorithmHint().ifPresent(hint -> {
            out.println();
            out.println("Looks like: " + hint.pattern().name() + " (expected " + hint.pattern().expectedComplexity() + ")");
        });

        report.validation().ifPresent(validation -> printValidation(out, validation));
    }

    private static void printValidation(PrintWriter out, ComparisonResult validation) {
        out.println();
        out.printf(Locale.ROOT, "Validation: %.2f%% agreement%n", validation.agreementScore());
        for (BoundComparison detail : validation.details()) {
            out.printf(Locale.ROOT, "  %-5s computed %s, expected %s%s%n", detail.bound(), detail.deterministic(),
                    detail.external(), detail.match() ? "" : "  MISMATCH");
        }
    }
}
