package org.spicenum.cli.commands;

import org.spicenum.number.lexer.MagnitudeSuffix;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "suffixes", description = "Lists the magnitude suffixes accepted after a number.")
public class SuffixesCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        out.println(String.format("%-8s %-6s %s", "Symbol", "Prefix", "Exponent"));
        for (MagnitudeSuffix suffix : MagnitudeSuffix.values()) {
            out.println(String.format("%-8s %-6s E%+03d", suffix.notation(), suffix.prefix(), suffix.exponent()));
        }
        return 0;
    }
}
