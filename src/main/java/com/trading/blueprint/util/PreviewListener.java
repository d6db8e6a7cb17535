package com.trading.blueprint.util;

import com.trading.blueprint.CompilerOptions;
import com.trading.blueprint.api.GraphEvent;
import com.trading.blueprint.api.GraphListener;
import com.trading.blueprint.engine.CodeGenerator;
import com.trading.blueprint.model.BlueprintGraph;
import java.util.function.Consumer;

/**
 * Regenerates the preview source after every structural change and hands it
 * to a sink, typically a code view.
 */
public class PreviewListener implements GraphListener {
    private final CodeGenerator generator;
    private final Consumer<String> sink;
    private String lastPreview;

    public PreviewListener(BlueprintGraph graph, CompilerOptions options, Consumer<String> sink) {
        this.generator = new CodeGenerator(graph, options);
        this.sink = sink;
    }

    /** Registers a new listener on {@code graph} and pushes the current preview once. */
    public static PreviewListener attach(BlueprintGraph graph, CompilerOptions options, Consumer<String> sink) {
        PreviewListener listener = new PreviewListener(graph, options, sink);
        graph.addListener(listener);
        listener.refresh();
        return listener;
    }

    @Override
    public void onGraphChanged(GraphEvent event) {
        refresh();
    }

    public void refresh() {
        lastPreview = generator.generatePreview();
        sink.accept(lastPreview);
    }

    public String lastPreview() {
        return lastPreview;
    }
}
