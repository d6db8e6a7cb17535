package com.trading.blueprint.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.blueprint.CompilerOptions;
import com.trading.blueprint.SampleGraphs;
import com.trading.blueprint.catalog.NodeCatalog;
import com.trading.blueprint.engine.CodeGenerator;
import com.trading.blueprint.io.GraphSerializer;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.*;

public class BlueprintApiTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final BlueprintApi api = new BlueprintApi(CompilerOptions.defaults());
    private final String maBreakout = new GraphSerializer().toJson(SampleGraphs.maBreakout());

    @Test
    public void testCatalogListsCategoriesInPaletteOrder() throws Exception {
        JsonNode root = mapper.readTree(api.catalogJson());

        assertEquals(6, root.size());
        assertEquals("data", root.get(0).get("category").asText());
        assertEquals("param", root.get(5).get("category").asText());

        JsonNode buy = null;
        for (JsonNode n : root.get(4).get("nodes")) {
            if (n.get("type").asText().equals("trade.buy"))
                buy = n;
        }
        assertNotNull(buy);
        assertEquals("condition", buy.get("inputs").get(0).get("name").asText());
        assertTrue(buy.get("inputs").get(0).get("required").asBoolean());
        assertEquals("BOOLEAN", buy.get("inputs").get(0).get("type").asText());
        assertEquals(0, buy.get("outputs").size());
        assertEquals("quantity", buy.get("parameters").get(0).get("name").asText());
        assertEquals("int", buy.get("parameters").get(0).get("kind").asText());
        assertEquals(10000.0, buy.get("parameters").get(0).get("max").asDouble(), 0.0);
    }

    @Test
    public void testDescribeCatalogCoversEveryType() {
        NodeCatalog catalog = new NodeCatalog();
        List<Map<String, Object>> described = BlueprintApi.describeCatalog(catalog);
        int total = 0;
        for (Map<String, Object> c : described)
            total += ((List<?>) c.get("nodes")).size();
        assertEquals(catalog.types().size(), total);
    }

    @Test
    public void testValidate() throws Exception {
        JsonNode ok = mapper.readTree(api.validateJson(maBreakout));
        assertTrue(ok.get("valid").asBoolean());
        assertEquals(0, ok.get("issues").size());
        assertEquals(21, ok.get("lookback").asInt());

        JsonNode empty = mapper.readTree(api.validateJson(""));
        assertFalse(empty.get("valid").asBoolean());
        assertEquals(1, empty.get("issues").size());
        assertEquals(1, empty.get("lookback").asInt());
    }

    @Test
    public void testGenerateAndPreview() {
        String named = api.generate(maBreakout, "MaStrategy");
        assertEquals(new CodeGenerator(SampleGraphs.maBreakout()).generate("MaStrategy"), named);

        assertTrue(api.generate(maBreakout, null).contains("class BlueprintStrategy(BaseStrategy):"));
        assertTrue(api.generate(maBreakout, " ").contains("class BlueprintStrategy(BaseStrategy):"));
        assertEquals(CodeGenerator.EMPTY_PREVIEW, api.preview(null));
        assertEquals(api.generate(maBreakout, null), api.preview(maBreakout));
    }

    @Test
    public void testBlankNodeIdIsNotFatal() throws Exception {
        String body = "{\"nodes\":["
                + "{\"node_id\":\"\",\"node_type\":\"data.bar\"},"
                + "{\"node_id\":\"b1\",\"node_type\":\"trade.buy\"}]}";

        JsonNode result = mapper.readTree(api.validateJson(body));
        assertFalse(result.get("valid").asBoolean());
        assertEquals("Node 'Buy' [b1]: required input 'condition' is not connected",
                result.get("issues").get(0).asText());
        assertTrue(api.preview(body).contains("validation failed"));
    }

    @Test(expected = UncheckedIOException.class)
    public void testMalformedBody() {
        api.validateJson("not json");
    }

    @Test
    public void testErrorJson() throws Exception {
        assertEquals("boom", mapper.readTree(api.errorJson("boom")).get("error").asText());
        assertEquals("null", mapper.readTree(api.errorJson(null)).get("error").asText());
    }
}
