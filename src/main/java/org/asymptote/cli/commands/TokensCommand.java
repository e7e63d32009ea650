package org.asymptote.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

import org.asymptote.cli.CommandLineInterface;
import org.asymptote.compiler.api.AnalysisContext;
import org.asymptote.compiler.api.AnalysisException;
import org.asymptote.compiler.api.AnalysisOptions;
import org.asymptote.compiler.frontend.lexer.Lexer;
import org.asymptote.compiler.model.Token;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "tokens",
    description = "Prints the token stream of a pseudocode file"
)
public class TokensCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-f", "--file"}, required = true, description = "The pseudocode file to tokenize.")
    private File file;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final AnalysisOptions options;
        final String source;
        try {
            Config config = parent.getConfig();
            options = config.hasPath("asymptote.analysis")
                    ? AnalysisOptions.fromConfig(config.getConfig("asymptote.analysis"))
                    : AnalysisOptions.DEFAULT;
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: Cannot read " + file.getPath() + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        final List<Token> tokens;
        try {
            tokens = new Lexer(source, AnalysisContext.start(options)).scanTokens();
        } catch (AnalysisException e) {
            err.println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_ANALYSIS_FAILED;
        }

        for (Token token : tokens) {
            out.printf("%4d:%-3d %-14s %s%n", token.line(), token.column(), token.type(), token.text());
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }
}
