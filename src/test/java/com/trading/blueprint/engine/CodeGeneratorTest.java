package com.trading.blueprint.engine;

import com.trading.blueprint.CompilerOptions;
import com.trading.blueprint.SampleGraphs;
import com.trading.blueprint.model.BlueprintGraph;
import com.trading.blueprint.model.BlueprintNode;
import com.trading.blueprint.model.Position;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.*;

public class CodeGeneratorTest {

    private static final String MA_BREAKOUT = String.join("\n",
            "\"\"\"",
            "MaStrategy",
            "Generated from a visual strategy blueprint",
            "\"\"\"",
            "from core.strategy.base import BaseStrategy",
            "from core.indicators.technical import TechnicalIndicators",
            "",
            "",
            "class MaStrategy(BaseStrategy):",
            "    \"\"\"MaStrategy\"\"\"",
            "",
            "    # Strategy parameters",
            "    close_prices_count = 20",
            "    ma_period = 20",
            "    buy_quantity = 100",
            "",
            "    def on_bar(self, bar):",
            "        \"\"\"Per-bar callback\"\"\"",
            "        # Wait for enough history",
            "        if len(self.get_close_prices(21)) < 21:",
            "            return",
            "",
            "        _data_close_prices_c1_closes = self.get_close_prices(20)",
            "        _indicator_ma_m1_ma = TechnicalIndicators.MA(_data_close_prices_c1_closes, 20)",
            "        if (_data_close_prices_c1_closes[-1] > _indicator_ma_m1_ma[-1]):",
            "            if self.position == 0:",
            "                self.buy(bar.close, 100)",
            "");

    @Test
    public void testMaBreakoutStrategy() {
        String source = new CodeGenerator(SampleGraphs.maBreakout()).generate("MaStrategy");
        assertEquals(MA_BREAKOUT, source);
    }

    @Test
    public void testGenerationIsDeterministic() {
        BlueprintGraph g = SampleGraphs.maBreakout();
        CodeGenerator gen = new CodeGenerator(g);
        String first = gen.generate("MaStrategy");
        assertEquals(first, gen.generate("MaStrategy"));
        assertEquals(first, new CodeGenerator(g).generate("MaStrategy"));
    }

    @Test
    public void testCycleYieldsDiagnosticWithoutBody() {
        String source = new CodeGenerator(SampleGraphs.mutualAverages()).generate("Loop");

        assertTrue(source, source.startsWith("\"\"\"\nLoop: blueprint validation failed\n# Error: Graph contains a cycle"));
        assertTrue(source.endsWith("\"\"\""));
        assertFalse(source.contains("def on_bar"));
        assertFalse(source.contains("class "));
        assertFalse(source.contains("TechnicalIndicators.MA("));
    }

    @Test
    public void testMissingInputDiagnosticListsEveryIssue() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("logic.greater", "g1", Position.ORIGIN);

        String source = new CodeGenerator(g).generate("Broken");
        assertEquals(String.join("\n",
                "\"\"\"",
                "Broken: blueprint validation failed",
                "# Error: Node 'Greater >' [g1]: required input 'a' is not connected",
                "# Error: Node 'Greater >' [g1]: required input 'b' is not connected",
                "# Error: No trade node: the strategy will never place an order",
                "\"\"\""), source);
    }

    @Test
    public void testInputOverrideAndNoHistoryGuard() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("data.bar", "k1", Position.ORIGIN);
        g.addNode("trade.sell_all", "s1", Position.ORIGIN);
        g.addNode("logic.less", "l1", Position.ORIGIN);
        g.connect("k1", "close", "l1", "a");
        g.setInputOverride("l1", "b", 9.5);
        g.connect("l1", "result", "s1", "condition");

        String source = new CodeGenerator(g).generate("StopOut");
        // the typed-in literal is a parameter like any other
        assertTrue(source, source.contains("    # Strategy parameters\n    less__input_b = 9.5\n"));
        assertFalse(source.contains("# Wait for enough history"));
        assertFalse(source.contains("TechnicalIndicators"));
        assertTrue(source, source.endsWith(String.join("\n",
                "    def on_bar(self, bar):",
                "        \"\"\"Per-bar callback\"\"\"",
                "        if (bar.close < 9.5):",
                "            if self.position > 0:",
                "                self.sell(bar.close, self.position)",
                "")));
    }

    @Test
    public void testLiteralConditionOnTradeNode() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("trade.conditional_sell", "s1", Position.ORIGIN);
        g.setInputOverride("s1", "condition", true);

        String source = new CodeGenerator(g).generate("Flatten");
        assertTrue(source, source.contains("        if self.position > 0 and True:\n"
                + "            self.sell(bar.close, self.position)\n"));
    }

    @Test
    public void testProducersEmitOnceAndBeforeConsumers() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("trade.buy", "b1", Position.ORIGIN);
        g.addNode("signal.cross_over", "x1", Position.ORIGIN);
        g.addNode("indicator.ema", "fast", Position.ORIGIN);
        g.addNode("indicator.ema", "slow", Position.ORIGIN);
        g.addNode("data.close_prices", "c1", Position.ORIGIN);
        g.setParameter("fast", "period", 5);
        g.connect("c1", "prices", "fast", "data");
        g.connect("c1", "prices", "slow", "data");
        g.connect("fast", "ema", "x1", "fast");
        g.connect("slow", "ema", "x1", "slow");
        g.connect("x1", "signal", "b1", "condition");

        String source = new CodeGenerator(g).generate("EmaCross");
        int closes = source.indexOf("_data_close_prices_c1_closes = ");
        int fast = source.indexOf("_indicator_ema_fast_ema = TechnicalIndicators.EMA(_data_close_prices_c1_closes, 5)");
        int slow = source.indexOf("_indicator_ema_slow_ema = TechnicalIndicators.EMA(_data_close_prices_c1_closes, 20)");
        int cross = source.indexOf("_signal_cross_over_x1_cross_over = TechnicalIndicators.cross_over("
                + "_indicator_ema_fast_ema, _indicator_ema_slow_ema)[-1]");
        int buy = source.indexOf("if _signal_cross_over_x1_cross_over:");
        assertTrue(source, closes > 0 && closes < fast && fast < slow && slow < cross && cross < buy);
        assertEquals(closes, source.lastIndexOf("_data_close_prices_c1_closes = "));
        // one import line despite three emitting nodes
        assertEquals(source.indexOf("import TechnicalIndicators"), source.lastIndexOf("import TechnicalIndicators"));
    }

    @Test
    public void testTupleBindingForDmi() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("data.high_prices", "h", Position.ORIGIN);
        g.addNode("data.low_prices", "l", Position.ORIGIN);
        g.addNode("data.close_prices", "c", Position.ORIGIN);
        g.addNode("indicator.dmi", "d", Position.ORIGIN);
        g.addNode("param.get_last", "p", Position.ORIGIN);
        g.addNode("param.get_last", "m", Position.ORIGIN);
        g.addNode("logic.greater", "gt", Position.ORIGIN);
        g.addNode("trade.buy", "b", Position.ORIGIN);
        g.connect("h", "prices", "d", "high");
        g.connect("l", "prices", "d", "low");
        g.connect("c", "prices", "d", "close");
        g.connect("d", "pdi", "p", "series");
        g.connect("d", "mdi", "m", "series");
        g.connect("p", "value", "gt", "a");
        g.connect("m", "value", "gt", "b");
        g.connect("gt", "result", "b", "condition");

        String source = new CodeGenerator(g).generate("DmiTrend");
        assertTrue(source, source.contains("        _data_high_prices_h_highs = [b.high for b in self.get_bars(20)]\n"));
        assertTrue(source, source.contains("        _indicator_dmi_d_dmi_pdi, _indicator_dmi_d_dmi_mdi, _indicator_dmi_d_dmi_adx = "
                + "TechnicalIndicators.DMI(_data_high_prices_h_highs, _data_low_prices_l_lows, "
                + "_data_close_prices_c_closes, 14)\n"));
        assertTrue(source, source.contains("        if (_indicator_dmi_d_dmi_pdi[-1] > _indicator_dmi_d_dmi_mdi[-1]):\n"));
    }

    @Test
    public void testClassNameIsSanitised() {
        String source = new CodeGenerator(SampleGraphs.maBreakout()).generate("2nd strategy!");
        assertTrue(source, source.contains("class _2nd_strategy_(BaseStrategy):"));
        assertEquals("BlueprintStrategy", CodeGenerator.className("  "));
        assertEquals("BlueprintStrategy", CodeGenerator.className(null));
    }

    @Test
    public void testOptionsShapeTheOutput() {
        CompilerOptions options = CompilerOptions.defaults();
        options.setStrategyName("Configured");
        options.setIndent("  ");
        options.setBaseImport("from engine import Strategy");
        options.setBaseClass("Strategy");

        String source = new CodeGenerator(SampleGraphs.maBreakout(), options).generate();
        assertTrue(source, source.contains("from engine import Strategy\n"));
        assertTrue(source, source.contains("class Configured(Strategy):\n  \"\"\"Configured\"\"\"\n"));
        assertTrue(source, source.contains("\n  def on_bar(self, bar):\n"));
        assertTrue(source, source.contains("\n    if (_data_close_prices_c1_closes[-1] > _indicator_ma_m1_ma[-1]):\n"
                + "      if self.position == 0:\n"
                + "        self.buy(bar.close, 100)\n"));
    }

    @Test
    public void testPreview() {
        assertEquals(CodeGenerator.EMPTY_PREVIEW, new CodeGenerator(new BlueprintGraph()).generatePreview());

        BlueprintGraph g = SampleGraphs.maBreakout();
        assertEquals(new CodeGenerator(g).generate(), new CodeGenerator(g).generatePreview());
    }

    @Test
    public void testParameterNameCollision() {
        BlueprintGraph g = new BlueprintGraph();
        BlueprintNode a = g.addNode("indicator.ma", "ma_a", Position.ORIGIN);
        BlueprintNode b = g.addNode("indicator.ma", "ma_b", Position.ORIGIN);
        g.addNode("indicator.ma", "ma_c", Position.ORIGIN);
        g.setParameter(a.id(), "period", 5);
        g.setParameter(b.id(), "period", 60);

        Map<String, Object> params = new CodeGenerator(g).collectParameters();
        assertEquals(Map.of("ma_period", 5, "ma_period_ma_b", 60, "ma_period_ma_c", 20), params);
    }

    @Test
    public void testEqualParametersShareOneAttribute() {
        BlueprintGraph g = new BlueprintGraph();
        g.addNode("indicator.rsi", "r1", Position.ORIGIN);
        g.addNode("indicator.rsi", "r2", Position.ORIGIN);

        Map<String, Object> params = new CodeGenerator(g).collectParameters();
        assertEquals(1, params.size());
        assertEquals(14, params.get("rsi_period"));
    }
}
