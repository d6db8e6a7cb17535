package com.trading.blueprint;

import com.trading.blueprint.model.BlueprintGraph;
import com.trading.blueprint.model.BlueprintNode;
import com.trading.blueprint.model.Position;
import com.trading.blueprint.util.PreviewListener;

import lombok.extern.log4j.Log4j2;

/**
 * Builds a moving-average crossover blueprint in code, the way an editor
 * would, and prints the live preview, the topology and the saved form.
 */
@Log4j2
public class MaCrossDemo {

    public static void main(String[] args) {
        log.info("Starting MA Cross Demo...");

        Blueprint bp = new Blueprint();
        BlueprintGraph graph = bp.graph();
        PreviewListener preview = PreviewListener.attach(graph, bp.options(), src -> {
        });

        // 1. Data and indicators
        BlueprintNode closes = graph.addNode("data.close_prices", new Position(40, 80));
        BlueprintNode fast = graph.addNode("indicator.ma", new Position(260, 40));
        BlueprintNode slow = graph.addNode("indicator.ma", new Position(260, 160));
        graph.setParameter(fast.id(), "period", 5);
        graph.setParameter(slow.id(), "period", 20);
        graph.connect(closes.id(), "prices", fast.id(), "data");
        graph.connect(closes.id(), "prices", slow.id(), "data");

        // 2. Signals
        BlueprintNode golden = graph.addNode("signal.cross_over", new Position(480, 40));
        BlueprintNode death = graph.addNode("signal.cross_under", new Position(480, 160));
        graph.connect(fast.id(), "ma", golden.id(), "fast");
        graph.connect(slow.id(), "ma", golden.id(), "slow");
        graph.connect(fast.id(), "ma", death.id(), "fast");
        graph.connect(slow.id(), "ma", death.id(), "slow");

        // 3. Orders
        BlueprintNode buy = graph.addNode("trade.buy", new Position(700, 40));
        BlueprintNode sell = graph.addNode("trade.sell_all", new Position(700, 160));
        graph.connect(golden.id(), "signal", buy.id(), "condition");
        graph.connect(death.id(), "signal", sell.id(), "condition");

        log.info("Validation: {}", bp.validate());
        log.info("Topology:\n{}", bp.explain().dumpTopology());
        log.info("Generated strategy:\n{}", preview.lastPreview());
        log.info("Saved form:\n{}", bp.toJson());
    }
}
