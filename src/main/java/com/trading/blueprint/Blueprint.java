package com.trading.blueprint;

import com.trading.blueprint.engine.CodeGenerator;
import com.trading.blueprint.engine.GraphAnalyzer;
import com.trading.blueprint.engine.ValidationResult;
import com.trading.blueprint.io.GraphSerializer;
import com.trading.blueprint.model.BlueprintGraph;
import com.trading.blueprint.util.GraphExplain;
import com.trading.blueprint.web.BlueprintApi;
import com.trading.blueprint.web.BlueprintServer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A high-level wrapper that ties a blueprint graph to its analyzer, generator
 * and serializer.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading and saving blueprint JSON documents</li>
 * <li>Validation and lookback queries through {@link GraphAnalyzer}</li>
 * <li>Strategy source generation through {@link CodeGenerator}</li>
 * </ul>
 *
 * <p>
 * Command line: {@code serve [port]} starts {@link BlueprintServer};
 * {@code <graph.json> [StrategyName] [out.py]} compiles one saved blueprint.
 */
public class Blueprint {
    private static final Logger log = LogManager.getLogger(Blueprint.class);

    private final BlueprintGraph graph;
    private final CompilerOptions options;
    private final GraphSerializer serializer = new GraphSerializer();

    public Blueprint() {
        this(new BlueprintGraph(), CompilerOptions.load());
    }

    public Blueprint(BlueprintGraph graph, CompilerOptions options) {
        this.graph = graph;
        this.options = options;
    }

    /** Loads a saved blueprint with the classpath options. */
    public static Blueprint load(Path file) throws IOException {
        Blueprint bp = new Blueprint();
        bp.serializer.fromJson(Files.readString(file), bp.graph);
        log.info("Loaded blueprint {} ({} nodes, {} connections)",
                file, bp.graph.nodeCount(), bp.graph.connectionCount());
        return bp;
    }

    public static Blueprint fromJson(String json) {
        Blueprint bp = new Blueprint();
        bp.serializer.fromJson(json, bp.graph);
        return bp;
    }

    public BlueprintGraph graph() {
        return graph;
    }

    public CompilerOptions options() {
        return options;
    }

    public ValidationResult validate() {
        return new GraphAnalyzer(graph).validate();
    }

    public int requiredLookback() {
        return new GraphAnalyzer(graph).requiredLookback();
    }

    public String generate() {
        return new CodeGenerator(graph, options).generate();
    }

    public String generate(String strategyName) {
        return new CodeGenerator(graph, options).generate(strategyName);
    }

    public String preview() {
        return new CodeGenerator(graph, options).generatePreview();
    }

    public String toJson() {
        return serializer.toJson(graph);
    }

    public void save(Path file) throws IOException {
        serializer.write(graph, file);
    }

    public GraphExplain explain() {
        return new GraphExplain(graph);
    }

    public static void main(String[] args) throws IOException {
        if (args.length == 0) {
            System.err.println("Usage: serve [port] | <graph.json> [StrategyName] [out.py]");
            System.exit(2);
        }
        if (args[0].equals("serve")) {
            CompilerOptions options = CompilerOptions.load();
            int port = args.length > 1 ? Integer.parseInt(args[1]) : options.getServerPort();
            BlueprintServer server = new BlueprintServer(new BlueprintApi(options));
            server.start(port);
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
            return;
        }

        Blueprint bp = load(Path.of(args[0]));
        ValidationResult result = bp.validate();
        for (String issue : result.issues())
            log.warn("Issue: {}", issue);
        String source = args.length > 1 ? bp.generate(args[1]) : bp.generate();
        if (args.length > 2) {
            Files.writeString(Path.of(args[2]), source);
            log.info("Wrote {}", args[2]);
        } else {
            System.out.println(source);
        }
        if (!result.valid())
            System.exit(1);
    }
}
