package org.pointerviz.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;

import org.pointerviz.compiler.diagnostics.Diagnostic;
import org.pointerviz.compiler.frontend.io.SourceLoader;
import org.pointerviz.compiler.resolver.DeclarationResolver;
import org.pointerviz.compiler.resolver.ResolutionResult;

import picocli.CommandLine.Option;

/**
 * Where a command reads its program from: a file or a bundled example, exactly one of them.
 */
public class SourceOptions {

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Path to the declaration source file"
    )
    Path file;

    @Option(
        names = {"-e", "--example"},
        required = true,
        description = "Name of a bundled example (see 'pointerviz examples')"
    )
    String example;

    SourceLoader.LoadResult load() throws IOException {
        return file != null ? SourceLoader.loadFile(file) : SourceLoader.loadExample(example);
    }

    /**
     * Loads and resolves the program, printing every diagnostic to {@code err}.
     */
    ResolutionResult resolve(DeclarationResolver resolver, PrintWriter err) throws IOException {
        SourceLoader.LoadResult source = load();
        ResolutionResult result = resolver.resolve(source.content(), source.logicalName());
        for (Diagnostic diagnostic : result.diagnostics()) {
            err.println(diagnostic.format());
        }
        if (!result.isSuccess()) {
            err.println("Resolution failed with " + result.errors().size() + " error(s).");
        }
        err.flush();
        return result;
    }
}
