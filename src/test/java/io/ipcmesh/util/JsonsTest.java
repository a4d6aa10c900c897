package io.ipcmesh.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

final class JsonsTest {

    @Test
    void parseTreatsBlankAsNullAndRejectsGarbage() {
        Assertions.assertTrue(Jsons.parse("  ").isNull());
        Assertions.assertEquals(3, Jsons.parse("{\"a\":3}").path("a").asInt());
        Assertions.assertThrows(IllegalArgumentException.class, () -> Jsons.parse("{oops"));
    }

    @Test
    void convertHandlesNullAndTypedTargets() {
        JsonNode tree = Jsons.toTree(Map.of("a", 1));

        Assertions.assertNull(Jsons.convert(Jsons.toTree(null), Map.class));
        Assertions.assertSame(tree, Jsons.convert(tree, JsonNode.class));
        Assertions.assertEquals(Map.of("a", 1), Jsons.convert(tree, Map.class));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Jsons.convert(tree, Integer.class));
    }

    @Test
    void toJsonIsIndented() {
        Assertions.assertTrue(Jsons.toJson(Map.of("a", 1)).contains("\n"));
    }
}
