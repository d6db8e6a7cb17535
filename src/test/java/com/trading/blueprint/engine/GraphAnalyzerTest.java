package com.trading.blueprint.engine;

import com.trading.blueprint.SampleGraphs;
import com.trading.blueprint.model.BlueprintGraph;
import com.trading.blueprint.model.BlueprintNode;
import com.trading.blueprint.model.PortRef;
import com.trading.blueprint.model.Position;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphAnalyzerTest {

    private static List<String> ids(List<BlueprintNode> nodes) {
        return nodes.stream().map(BlueprintNode::id).toList();
    }

    @Test
    public void testValidBlueprintHasNoIssues() {
        ValidationResult result = new GraphAnalyzer(SampleGraphs.maBreakout()).validate();
        assertTrue(result.issues().toString(), result.valid());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    public void testExecutionOrderPutsProducersFirst() {
        GraphAnalyzer analyzer = new GraphAnalyzer(SampleGraphs.maBreakout());
        assertEquals(List.of("c1", "m1", "g1", "b1"), ids(analyzer.executionOrder()));
    }

    @Test
    public void testMutualDependencyIsACycle() {
        GraphAnalyzer analyzer = new GraphAnalyzer(SampleGraphs.mutualAverages());

        assertTrue(analyzer.hasCycle());
        ValidationResult result = analyzer.validate();
        assertFalse(result.valid());
        assertEquals(1, result.issues().size());
        String issue = result.issues().get(0);
        assertTrue(issue, issue.startsWith("Graph contains a cycle"));
        assertTrue(issue, issue.contains("[ma1]"));
        assertTrue(issue, issue.contains("[ma2]"));
        assertFalse(issue, issue.contains("[b1]"));
    }

    @Test
    public void testExecutionOrderThrowsOnCycle() {
        GraphAnalyzer analyzer = new GraphAnalyzer(SampleGraphs.mutualAverages());
        try {
            analyzer.executionOrder();
            fail("Expected CycleDetectedException");
        } catch (CycleDetectedException e) {
            assertEquals(1, e.resolved());
            assertEquals(3, e.total());
            assertEquals("Cycle detected! Ordered 1 of 3 nodes", e.getMessage());
        }
    }

    @Test
    public void testSingleUnconnectedInput() {
        BlueprintGraph g = SampleGraphs.maBreakout();
        g.removeConnection(g.connectionsAt(PortRef.input("g1", "b")).get(0).id());

        ValidationResult result = new GraphAnalyzer(g).validate();
        assertEquals(List.of("Node 'Greater >' [g1]: required input 'b' is not connected"), result.issues());
    }

    @Test
    public void testOverrideSatisfiesRequiredInput() {
        BlueprintGraph g = SampleGraphs.maBreakout();
        g.removeConnection(g.connectionsAt(PortRef.input("g1", "b")).get(0).id());
        g.setInputOverride("g1", "b", 10.5);

        assertTrue(new GraphAnalyzer(g).validate().valid());
    }

    @Test
    public void testMissingTradeNode() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("data.close_prices", "c1", Position.ORIGIN);
        g.addNode("indicator.rsi", "r1", Position.ORIGIN);
        g.connect("c1", "prices", "r1", "data");

        ValidationResult result = new GraphAnalyzer(g).validate();
        assertEquals(List.of("No trade node: the strategy will never place an order"), result.issues());
    }

    @Test
    public void testIssuesAccumulate() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("logic.and", "a1", Position.ORIGIN);

        ValidationResult result = new GraphAnalyzer(g).validate();
        assertEquals(3, result.issues().size());
        assertTrue(result.issues().get(0).contains("'a'"));
        assertTrue(result.issues().get(1).contains("'b'"));
        assertTrue(result.issues().get(2).startsWith("No trade node"));
    }

    @Test
    public void testEmptyGraphNeedsATradeNode() {
        ValidationResult result = new GraphAnalyzer(new BlueprintGraph()).validate();
        assertFalse(result.valid());
        assertEquals(1, result.issues().size());
    }

    @Test
    public void testLookbackCoversPeriodAndSlow() {
        BlueprintGraph g = new BlueprintGraph();
        BlueprintNode ema = g.addNode("indicator.ema", Position.ORIGIN);
        g.addNode("indicator.macd", Position.ORIGIN);
        g.setParameter(ema.id(), "period", 26);

        // macd: slow 26 + 10 beats ema: period 26 + 1
        assertEquals(36, new GraphAnalyzer(g).requiredLookback());
    }

    @Test
    public void testLookbackTakesCountAsIs() {
        BlueprintGraph g = new BlueprintGraph();
        BlueprintNode closes = g.addNode("data.close_prices", Position.ORIGIN);
        g.setParameter(closes.id(), "count", 120);

        assertEquals(120, new GraphAnalyzer(g).requiredLookback());
    }

    @Test
    public void testLookbackFloorIsOne() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("logic.greater", Position.ORIGIN);
        assertEquals(1, new GraphAnalyzer(g).requiredLookback());
        assertEquals(1, new GraphAnalyzer(new BlueprintGraph()).requiredLookback());
    }

    @Test
    public void testLookbackIgnoresUnreadableValues() {
        BlueprintGraph g = new BlueprintGraph();
        BlueprintNode node = g.addNode("param.number", Position.ORIGIN);
        g.setParameter(node.id(), "period", "long");
        assertEquals(1, new GraphAnalyzer(g).requiredLookback());
    }

    @Test
    public void testLookbackSaturatesOnHugeValues() {
        BlueprintGraph g = new BlueprintGraph();
        BlueprintNode ma = g.addNode("indicator.ma", Position.ORIGIN);
        g.replaceParameters(ma.id(), Map.of("period", Integer.MAX_VALUE));
        assertEquals(Integer.MAX_VALUE, new GraphAnalyzer(g).requiredLookback());

        g.replaceParameters(ma.id(), Map.of("period", 5_000_000_000L));
        assertEquals(Integer.MAX_VALUE, new GraphAnalyzer(g).requiredLookback());

        g.replaceParameters(ma.id(), Map.of("period", Long.MIN_VALUE));
        assertEquals(1, new GraphAnalyzer(g).requiredLookback());
    }

    @Test
    public void testDependenciesAreDepthFirstAndExcludeSelf() {
        GraphAnalyzer analyzer = new GraphAnalyzer(SampleGraphs.maBreakout());

        assertEquals(List.of("g1", "c1", "m1"), ids(analyzer.dependencies("b1")));
        assertEquals(List.of("c1"), ids(analyzer.dependencies("m1")));
        assertTrue(analyzer.dependencies("c1").isEmpty());
    }

    @Test
    public void testDependenciesTerminateOnCycle() {
        GraphAnalyzer analyzer = new GraphAnalyzer(SampleGraphs.mutualAverages());
        assertEquals(List.of("ma2"), ids(analyzer.dependencies("ma1")));
    }

    @Test
    public void testDependents() {
        GraphAnalyzer analyzer = new GraphAnalyzer(SampleGraphs.maBreakout());
        assertEquals(List.of("m1", "g1", "b1"), ids(analyzer.dependents("c1")));
        assertTrue(analyzer.dependents("b1").isEmpty());
    }

    @Test
    public void testCategoryQueries() {
        GraphAnalyzer analyzer = new GraphAnalyzer(SampleGraphs.maBreakout());
        assertEquals(List.of("b1"), ids(analyzer.tradeNodes()));
        assertEquals(List.of("c1"), ids(analyzer.dataNodes()));
    }
}
