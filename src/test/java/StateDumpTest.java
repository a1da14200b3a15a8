import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.oxlang.script.OxError;
import com.oxlang.script.OxScript;
import com.oxlang.script.StateDump;

public class StateDumpTest {

    @Test
    void globals_renderAsJson() {
        OxScript ox = new OxScript();
        ObjectNode g = StateDump.globals(ox.run(
                "struct Point { x, y }\n" +
                "struct P3 inherits Point { z }\n" +
                "func f(a) { return a }\n" +
                "func Point:norm(self) { return 0 }\n" +
                "n = 3\n" +
                "s = \"hi\"\n" +
                "ok = true\n" +
                "arr = [1, [2], nil]\n" +
                "p = Point(1, 2)\n"
        ).globals());

        assertEquals(3.0, g.get("n").asDouble(), 1e-9);
        assertEquals("hi", g.get("s").asText());
        assertTrue(g.get("ok").asBoolean());
        assertEquals(3, g.get("arr").size());
        assertTrue(g.get("arr").get(2).isNull());
        assertEquals("Point", g.get("p").get("$struct").asText());
        assertEquals(2.0, g.get("p").get("y").asDouble(), 1e-9);
        assertEquals("f", g.get("f").get("$function").asText());

        JsonNode p3 = g.get("P3");
        assertEquals("P3", p3.get("$type").asText());
        assertEquals("Point", p3.get("parent").asText());
        assertEquals(3, p3.get("fields").size());
        assertEquals("norm", g.get("Point").get("methods").get(0).asText());
    }

    @Test
    void error_rendersKindPositionAndTrace() {
        OxScript ox = new OxScript();
        OxError e = assertThrows(OxError.class, () -> ox.run("func f() { return nope }\n\nf()"));

        ObjectNode n = StateDump.error(e);
        assertEquals("NameError", n.get("kind").asText());
        assertEquals(1, n.get("line").asInt());
        assertEquals("f (line 3)", n.get("trace").get(0).asText());
        assertTrue(StateDump.pretty(n).contains("\"kind\" : \"NameError\""));
    }

    @Test
    void selfReferences_renderAsCycleMarkers() {
        OxScript ox = new OxScript();
        ObjectNode g = StateDump.globals(ox.run(
                "struct Node { next }\n" +
                "n = Node(nil)\n" +
                "n.next = n\n" +
                "a = [1]\n" +
                "a += a\n"
        ).globals());

        assertEquals("array", g.get("a").get(1).get("$cycle").asText());
        assertEquals("Node", g.get("n").get("next").get("$cycle").asText());
        assertEquals("Node(next=Node(...))", ox.get("n").toString());
    }
}
