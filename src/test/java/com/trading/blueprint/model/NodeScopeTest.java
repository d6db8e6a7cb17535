package com.trading.blueprint.model;

import com.trading.blueprint.SampleGraphs;
import org.junit.Test;

import static org.junit.Assert.*;

public class NodeScopeTest {

    @Test
    public void testConnectionWins() {
        BlueprintGraph g = SampleGraphs.maBreakout();
        g.setInputOverride("g1", "a", 1);
        g.setParameter("g1", "a", 2);

        assertEquals("_data_close_prices_c1_closes[-1]", g.scope("g1").inputValue("a"));
    }

    @Test
    public void testOverrideBeforeParameterBeforeDefault() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("trade.buy", "b1", Position.ORIGIN);
        NodeScope scope = g.scope("b1");

        // declared default of the port
        g.removeParameter("b1", "quantity");
        assertEquals("100", scope.inputValue("quantity"));

        // parameter of the same name
        g.setParameter("b1", "quantity", 300);
        assertEquals("300", scope.inputValue("quantity"));

        // override beats the parameter
        g.setInputOverride("b1", "quantity", 500);
        assertEquals("500", scope.inputValue("quantity"));
    }

    @Test
    public void testNothingResolves() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("trade.buy", "b1", Position.ORIGIN);
        NodeScope scope = g.scope("b1");

        assertNull(scope.inputValue("price"));
        assertEquals("bar.close", scope.inputOr("price", "bar.close"));
        assertFalse(scope.isSatisfied("condition"));
        assertNull(scope.inputValue("no_such_port"));
        assertFalse(scope.isSatisfied("no_such_port"));
    }

    @Test
    public void testLiteralsRenderAsPython() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("logic.and", "a1", Position.ORIGIN);
        g.addNode("signal.oversold", "o1", Position.ORIGIN);
        g.setInputOverride("a1", "a", true);
        g.setInputOverride("a1", "b", false);

        assertEquals("True", g.scope("a1").inputValue("a"));
        assertEquals("False", g.scope("a1").inputValue("b"));
        // float parameter keeps its fraction
        assertEquals("30.0", g.scope("o1").inputValue("threshold"));
    }

    @Test
    public void testSatisfiedDoesNotFollowConnections() {
        BlueprintGraph g = SampleGraphs.mutualAverages();
        assertTrue(g.scope("ma1").isSatisfied("data"));
        assertTrue(g.scope("ma1").isSatisfied("period"));
    }

    @Test
    public void testOutputExpressionsAndVariables() {
        BlueprintGraph g = SampleGraphs.maBreakout();
        NodeScope closes = g.scope("c1");

        assertEquals("c1", closes.nodeId());
        assertEquals("_data_close_prices_c1_closes", closes.outputExpression("prices"));
        assertEquals("_data_close_prices_c1_closes[-1]", closes.outputExpression("current"));
        assertEquals("_data_close_prices_c1_x", closes.variable("x"));
        assertEquals("(_data_close_prices_c1_closes[-1] > _indicator_ma_m1_ma[-1])",
                g.scope("g1").outputExpression("result"));
        assertEquals("20", closes.parameterText("count", 1));
        assertEquals("7", closes.parameterText("missing", 7));
    }

    @Test
    public void testVariableNamesAreSanitised() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("indicator.macd", "ab-cd ef", Position.ORIGIN);
        assertEquals("_indicator_macd_ab_cd_ef_macd_result", g.scope("ab-cd ef").variable("macd_result"));
        assertEquals("_indicator_macd_ab_cd_ef", g.node("ab-cd ef").variableName(null));
    }
}
