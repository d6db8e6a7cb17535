package com.trading.blueprint;

import com.trading.blueprint.model.BlueprintGraph;
import com.trading.blueprint.model.Position;

/**
 * Small blueprints shared by tests. Node ids are fixed so expected source
 * text can be written out literally.
 */
public final class SampleGraphs {
    private SampleGraphs() {
    }

    /**
     * closes(count 20) -> MA(20); closes.current > ma.current -> buy(100).
     */
    public static BlueprintGraph maBreakout() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("data.close_prices", "c1", new Position(40, 80));
        g.addNode("indicator.ma", "m1", new Position(260, 80));
        g.addNode("logic.greater", "g1", new Position(480, 80));
        g.addNode("trade.buy", "b1", new Position(700, 80));
        g.connect("c1", "prices", "m1", "data");
        g.connect("c1", "current", "g1", "a");
        g.connect("m1", "current", "g1", "b");
        g.connect("g1", "result", "b1", "condition");
        return g;
    }

    /** Two moving averages feeding each other. */
    public static BlueprintGraph mutualAverages() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("indicator.ma", "ma1", Position.ORIGIN);
        g.addNode("indicator.ma", "ma2", Position.ORIGIN);
        g.addNode("trade.buy", "b1", Position.ORIGIN);
        g.connect("ma1", "ma", "ma2", "data");
        g.connect("ma2", "ma", "ma1", "data");
        g.setInputOverride("b1", "condition", true);
        return g;
    }
}
