package com.trading.blueprint.catalog;

import com.trading.blueprint.api.DataType;
import com.trading.blueprint.api.NodeCategory;
import com.trading.blueprint.api.NodeSpec;
import com.trading.blueprint.api.ParameterDefinition;
import com.trading.blueprint.model.NodeScope;

/**
 * Order actions. Terminal nodes with no outputs: each emits one guarded
 * block that places an order when its condition holds. Orders default to the
 * current close.
 */
final class TradeNodes {
    static final int DEFAULT_QUANTITY = 100;

    private TradeNodes() {
    }

    static void register(NodeCatalog catalog) {
        catalog.register(base("trade.buy", "Buy", "Buy when the condition holds and nothing is held", true)
                .emitter((scope, ctx) -> ctx.addCode("if " + condition(scope) + ":\n"
                        + "    if self.position == 0:\n"
                        + "        self.buy(" + price(scope) + ", " + buyQuantity(scope) + ")"))
                .build());

        catalog.register(NodeSpec.builder("trade.sell", NodeCategory.TRADE)
                .title("Sell")
                .description("Sell when the condition holds; the whole position unless a quantity is given")
                .input("condition", DataType.BOOLEAN, "Condition")
                .optionalInput("price", DataType.NUMBER, "Price", null)
                .optionalInput("quantity", DataType.NUMBER, "Quantity", null)
                .emitter((scope, ctx) -> ctx.addCode("if " + condition(scope) + ":\n"
                        + "    if self.position > 0:\n"
                        + "        self.sell(" + price(scope) + ", " + scope.inputOr("quantity", "self.position")
                        + ")"))
                .build());

        catalog.register(base("trade.sell_all", "Sell All", "Close the whole position when the condition holds",
                false)
                .emitter((scope, ctx) -> ctx.addCode("if " + condition(scope) + ":\n"
                        + "    if self.position > 0:\n"
                        + "        self.sell(" + price(scope) + ", self.position)"))
                .build());

        catalog.register(base("trade.conditional_buy", "Buy If Flat", "Buy only while no position is held", true)
                .emitter((scope, ctx) -> ctx.addCode("if self.position == 0 and " + condition(scope) + ":\n"
                        + "    self.buy(" + price(scope) + ", " + buyQuantity(scope) + ")"))
                .build());

        catalog.register(base("trade.conditional_sell", "Sell If Held", "Sell the position only while one is held",
                false)
                .emitter((scope, ctx) -> ctx.addCode("if self.position > 0 and " + condition(scope) + ":\n"
                        + "    self.sell(" + price(scope) + ", self.position)"))
                .build());
    }

    private static NodeSpec.Builder base(String type, String title, String description, boolean withQuantity) {
        NodeSpec.Builder b = NodeSpec.builder(type, NodeCategory.TRADE)
                .title(title)
                .description(description)
                .input("condition", DataType.BOOLEAN, "Condition")
                .optionalInput("price", DataType.NUMBER, "Price", null);
        if (withQuantity) {
            b.optionalInput("quantity", DataType.NUMBER, "Quantity", DEFAULT_QUANTITY)
                    .parameter(ParameterDefinition.ofInt("quantity", "Quantity", DEFAULT_QUANTITY, 100, 10000));
        }
        return b;
    }

    private static String condition(NodeScope scope) {
        return scope.inputOr("condition", "False");
    }

    private static String price(NodeScope scope) {
        return scope.inputOr("price", "bar.close");
    }

    private static String buyQuantity(NodeScope scope) {
        return scope.inputOr("quantity", scope.parameterText("quantity", DEFAULT_QUANTITY));
    }
}
