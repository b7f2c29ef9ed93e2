package org.spicenum.cli.commands;

import org.spicenum.cli.CommandLineInterface;
import org.spicenum.number.api.NumberParseException;
import org.spicenum.number.api.SpiceNumber;
import org.spicenum.number.internal.i18n.Messages;
import org.spicenum.number.lexer.LiteralResolver;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(name = "compare", description = "Compares two literals by their resolved value, e.g. 1k and 1000.")
public class CompareCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "LEFT")
    private String left;

    @Parameters(index = "1", paramLabel = "RIGHT")
    private String right;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        // Loads the configuration for its logging settings.
        parent.getConfig();
        try {
            final SpiceNumber a = LiteralResolver.resolve(left);
            final SpiceNumber b = LiteralResolver.resolve(right);
            final int cmp = a.compareTo(b);
            final String relation = cmp < 0 ? "<" : cmp > 0 ? ">" : "=";
            spec.commandLine().getOut().println(a + " " + relation + " " + b);
            return 0;
        } catch (NumberParseException e) {
            spec.commandLine().getErr().println(Messages.describeRejection(e));
            return 1;
        }
    }
}
