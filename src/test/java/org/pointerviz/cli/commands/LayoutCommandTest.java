package org.pointerviz.cli.commands;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.pointerviz.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
public class LayoutCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void testLayoutPrintsNodesAndEdges() {
        int exitCode = execute("layout", "-e", "basics");

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(0);
        JsonObject root = JsonParser.parseString(out.toString()).getAsJsonObject();
        JsonArray nodes = root.getAsJsonArray("nodes");
        assertThat(nodes).hasSize(3);
        assertThat(root.getAsJsonArray("edges")).hasSize(2);
        assertThat(root.get("margin").getAsDouble()).isEqualTo(30.0);
        for (JsonElement node : nodes) {
            assertThat(node.getAsJsonObject().get("x").getAsDouble()).isGreaterThanOrEqualTo(30.0);
        }
        JsonObject a = nodes.get(0).getAsJsonObject();
        assertThat(a.get("name").getAsString()).isEqualTo("a");
        assertThat(a.get("layer").getAsInt()).isEqualTo(1);
    }

    @Test
    void testLayoutHonorsConfigFile() throws Exception {
        Path config = tempDir.resolve("custom.conf");
        Files.writeString(config, "pointerviz.layout.margin.small = 5\n");

        int exitCode = execute("--config", config.toString(), "layout", "-e", "basics");

        assertThat(exitCode).isEqualTo(0);
        JsonObject root = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(root.get("margin").getAsDouble()).isEqualTo(5.0);
    }

    @Test
    void testMissingConfigFileIsAUsageError() {
        int exitCode = execute("--config", tempDir.resolve("nope.conf").toString(), "layout", "-e", "basics");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("nope.conf");
    }

    @Test
    void testUnknownExampleFails() {
        int exitCode = execute("layout", "-e", "does-not-exist");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown example");
    }
}
