package org.pointerviz.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.pointerviz.compiler.frontend.io.SourceLoader;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "examples",
    description = "List the bundled example programs"
)
public class ExamplesCommand implements Callable<Integer> {

    @Option(
        names = {"-s", "--show"},
        description = "Print the source of the named example instead of the list"
    )
    private String show;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            if (show != null) {
                out.print(SourceLoader.loadExample(show).content());
            } else {
                List<String> names = SourceLoader.listExamples();
                names.forEach(out::println);
            }
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
        out.flush();
        return 0;
    }
}
