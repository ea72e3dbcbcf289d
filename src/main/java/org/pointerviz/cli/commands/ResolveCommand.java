package org.pointerviz.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.pointerviz.cli.CommandLineInterface;
import org.pointerviz.compiler.resolver.DeclarationResolver;
import org.pointerviz.compiler.resolver.ResolutionResult;
import org.pointerviz.model.MemoryGraph;
import org.pointerviz.model.MemoryObject;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Resolves a declaration program and prints the resulting memory graph.
 */
@Command(
    name = "resolve",
    description = "Resolve declarations and print the memory graph"
)
public class ResolveCommand implements Callable<Integer> {

    enum Format { TABLE, JSON }

    @ArgGroup(exclusive = true, multiplicity = "1")
    private SourceOptions source;

    @Option(
        names = {"--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})"
    )
    private Format format = Format.TABLE;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ResolutionResult result;
        try {
            result = source.resolve(new DeclarationResolver(), err);
        } catch (IOException e) {
            err.println("Error reading source: " + e.getMessage());
            return 1;
        }
        if (!result.isSuccess()) {
            return 1;
        }

        if (format == Format.JSON) {
            out.println(GraphJson.graph(result.graph()));
        } else {
            printTable(result.graph(), out);
        }
        out.flush();
        return 0;
    }

    private static void printTable(MemoryGraph graph, PrintWriter out) {
        String row = "%-12s %-10s %-20s %-8s %-10s %s%n";
        out.printf(row, "NAME", "KIND", "TYPE", "ADDRESS", "TARGET", "MODIFIABILITY");
        for (MemoryObject object : graph.objects()) {
            out.printf(row, object.name(), object.kind(), object.typeDescription(), object.address(),
                object.pointsTo().orElse(object.value().map(String::valueOf).orElse("-")), object.modifiability());
        }
        out.printf("%d object(s)%n", graph.size());
    }
}
