package org.pointerviz.compiler.frontend.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads declaration programs from the filesystem or from the bundled examples on the classpath.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The name used in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    /** Classpath directory holding the bundled example programs. */
    public static final String EXAMPLES_DIR = "examples/";
    private static final String EXAMPLES_INDEX = EXAMPLES_DIR + "index.txt";
    private static final String EXAMPLE_EXTENSION = ".ptr";

    private SourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The file to read.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.normalize().toString().replace('\\', '/');
        String content = normalizeLineEndings(Files.readString(path, StandardCharsets.UTF_8));
        return new LoadResult(content, logicalName);
    }

    /**
     * Loads content from a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @return The loaded content and the resource path as logical name.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = SourceLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String content = br.lines().collect(Collectors.joining("\n")) + "\n";
                return new LoadResult(content, resourcePath);
            }
        }
    }

    /**
     * Loads a bundled example by name, e.g. {@code pointer-chain}.
     *
     * @throws IOException If no such example exists.
     */
    public static LoadResult loadExample(String name) throws IOException {
        if (!listExamples().contains(name)) {
            throw new IOException("Unknown example '" + name + "'. Available: " + String.join(", ", listExamples()));
        }
        return loadClasspath(EXAMPLES_DIR + name + EXAMPLE_EXTENSION);
    }

    /**
     * Lists the names of the bundled examples, in the order of the examples index.
     *
     * @throws IOException If the index cannot be read.
     */
    public static List<String> listExamples() throws IOException {
        return loadClasspath(EXAMPLES_INDEX).content().lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .collect(Collectors.toList());
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
