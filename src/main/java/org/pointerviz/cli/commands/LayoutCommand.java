package org.pointerviz.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.pointerviz.cli.CommandLineInterface;
import org.pointerviz.compiler.resolver.DeclarationResolver;
import org.pointerviz.compiler.resolver.ResolutionResult;
import org.pointerviz.layout.LayoutEngine;
import org.pointerviz.layout.LayoutOptions;
import org.pointerviz.layout.LayoutResult;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Resolves a declaration program, lays it out and prints node coordinates as JSON.
 */
@Command(
    name = "layout",
    description = "Resolve declarations and print diagram coordinates as JSON"
)
public class LayoutCommand implements Callable<Integer> {

    @ArgGroup(exclusive = true, multiplicity = "1")
    private SourceOptions source;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
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

        Config layoutConfig = config.hasPath(LayoutOptions.CONFIG_PATH)
            ? config.getConfig(LayoutOptions.CONFIG_PATH)
            : ConfigFactory.empty();
        LayoutEngine engine = new LayoutEngine(LayoutOptions.fromConfig(layoutConfig));
        LayoutResult layout = engine.layout(result.graph());

        out.println(GraphJson.layout(result.graph(), layout));
        out.flush();
        return 0;
    }
}
