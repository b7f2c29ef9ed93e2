package org.spicenum.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import org.spicenum.cli.CommandLineInterface;
import org.spicenum.diagnostics.DiagnosticsEngine;
import org.spicenum.number.api.SpiceNumber;
import org.spicenum.number.scan.LiteralScanner;
import org.spicenum.number.scan.ScannedLiteral;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "resolve", description = "Resolves numeric literals given as arguments or read from a file.")
public class ResolveCommand implements Callable<Integer> {

    private static final String ARGUMENTS_SOURCE = "<args>";

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(arity = "0..*", paramLabel = "LITERAL", description = "Literals to resolve, e.g. 1.23k or 7343Meg.")
    private List<String> literals = new ArrayList<>();

    @Option(names = {"-f", "--file"}, description = "A file whose whitespace-separated tokens are resolved.")
    private File file;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES} (default: spicenum.output.format).")
    private OutputFormat format;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig();
        final OutputFormat outputFormat = format != null
                ? format
                : config.getEnum(OutputFormat.class, "spicenum.output.format");

        final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        final LiteralScanner scanner = new LiteralScanner(diagnostics, config.getBoolean("spicenum.scan.fail-fast"));
        final List<ScannedLiteral> resolved = new ArrayList<>(scanner.scanArguments(literals, ARGUMENTS_SOURCE));

        if (file != null && !scanner.isStopped()) {
            final String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
            resolved.addAll(scanner.scan(source, file.getName()));
        }

        print(resolved, outputFormat, spec.commandLine().getOut());

        if (!diagnostics.getDiagnostics().isEmpty()) {
            spec.commandLine().getErr().println(diagnostics.summary());
        }
        return diagnostics.hasErrors() ? 1 : 0;
    }

    private void print(List<ScannedLiteral> resolved, OutputFormat outputFormat, PrintWriter out) {
        if (outputFormat == OutputFormat.JSON) {
            final Gson gson = new GsonBuilder()
                    .setPrettyPrinting()
                    .serializeSpecialFloatingPointValues()
                    .create();
            final List<SpiceNumber> numbers = resolved.stream().map(ScannedLiteral::number).toList();
            out.println(gson.toJson(numbers));
        } else {
            for (ScannedLiteral literal : resolved) {
                out.println(literal.number().raw() + "\t" + literal.number().value());
            }
        }
        out.flush();
    }
}
