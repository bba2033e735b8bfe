package dev.multiverse.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.multiverse.engine.Declaration;
import dev.multiverse.engine.DeclarationException;
import dev.multiverse.engine.DeclarationLoader;
import dev.multiverse.engine.UniverseExpander;
import dev.multiverse.export.CodeExporter;
import dev.multiverse.export.CodeRenderer;
import dev.multiverse.export.DataExporter;
import dev.multiverse.export.ExportValidationException;
import dev.multiverse.export.JsonArtifacts;
import dev.multiverse.export.UniverseTable;
import dev.multiverse.model.Dataset;
import dev.multiverse.model.EngineSettings;
import dev.multiverse.model.Parameter;
import dev.multiverse.model.Universe;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point: validate a declaration, list its universes, and write the code and data artifacts.
 */
@Command(
    name = "multiverse",
    mixinStandardHelpOptions = true,
    description = "Expand analysis decision points into every universe and export viewer artifacts."
)
public class MultiverseCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_IO = 2;

    @Parameters(index = "0", description = "Declaration JSON file")
    private Path declarationFile;

    @Option(names = "--list", description = "Print every universe")
    private boolean list;

    @Option(names = "--dry-run", description = "Print parameters and universe count only")
    private boolean dryRun;

    @Option(names = "--verbose", description = "Print each parameter as a branch block")
    private boolean verbose;

    @Option(names = "--code-out", description = "Write code.json to this file")
    private Path codeOut;

    @Option(names = "--universes-out", description = "Write the universe table as JSON to this file")
    private Path universesOut;

    @Option(names = "--data", description = "Row-oriented JSON array of objects to convert")
    private Path data;

    @Option(names = "--data-out", description = "Write data.json to this file (requires --data)")
    private Path dataOut;

    @Option(names = "--grid", description = "Override CDF grid resolution")
    private Integer grid;

    @Option(names = "--concurrency", description = "Override worker pool size")
    private Integer concurrency;

    @Option(names = "--timeout-ms", description = "Override per-universe timeout in milliseconds")
    private Long timeoutMs;

    private final PrintStream out;
    private final PrintStream err;

    public MultiverseCli() {
        this(System.out, System.err);
    }

    MultiverseCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if ((data == null) != (dataOut == null)) {
            err.println("Error: --data and --data-out must be given together.");
            return EXIT_INVALID;
        }

        Declaration declaration;
        EngineSettings settings;
        try {
            declaration = DeclarationLoader.loadFromFile(declarationFile);
            settings = applyOverrides(declaration.settings());
        } catch (DeclarationException | IllegalArgumentException e) {
            err.println("Error: invalid declaration " + declarationFile + ": " + e.getMessage());
            return EXIT_INVALID;
        } catch (IOException e) {
            err.println("Error: cannot read " + declarationFile + ": " + e.getMessage());
            return EXIT_IO;
        }

        List<Universe> universes = UniverseExpander.expand(declaration.registry());

        out.println("Parameters:");
        for (Parameter p : declaration.registry().parameters()) {
            out.println("  " + p.name() + " " + p.optionNames());
            if (verbose) {
                CodeRenderer.renderBranch(p).lines().forEach(line -> out.println("    " + line));
            }
        }
        out.printf("Universes: %d (of %d unconditioned), grid resolution %d, concurrency %d%n",
            universes.size(), declaration.registry().unconditionedSize(), settings.gridResolution(),
            settings.concurrency());
        if (dryRun) {
            return EXIT_OK;
        }

        if (list) {
            universes.forEach(u -> out.printf("  #%-4d %s%n", u.id(), u.label()));
        }

        try {
            if (codeOut != null) {
                List<String> code = declaration.code().isEmpty() ? branchBlocks(declaration) : declaration.code();
                CodeExporter.export(code, declaration.registry(), codeOut);
                out.println("Wrote " + codeOut);
            }
            if (universesOut != null) {
                UniverseTable.export(universes, universesOut);
                out.println("Wrote " + universesOut);
            }
            if (data != null) {
                List<Map<String, Object>> rows = JsonArtifacts.mapper()
                    .readValue(data.toFile(), new TypeReference<List<Map<String, Object>>>() {});
                DataExporter.export(Dataset.fromRows(rows), dataOut);
                out.println("Wrote " + dataOut);
            }
        } catch (ExportValidationException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_IO;
        }
        return EXIT_OK;
    }

    private EngineSettings applyOverrides(EngineSettings settings) {
        EngineSettings result = settings;
        if (grid != null) {
            result = result.withGridResolution(grid);
        }
        if (concurrency != null) {
            result = result.withConcurrency(concurrency);
        }
        if (timeoutMs != null) {
            result = result.withUniverseTimeout(Duration.ofMillis(timeoutMs));
        }
        return result;
    }

    private static List<String> branchBlocks(Declaration declaration) {
        var blocks = new ArrayList<String>();
        declaration.registry().parameters().forEach(p -> blocks.add(CodeRenderer.renderBranch(p)));
        return blocks;
    }
}
