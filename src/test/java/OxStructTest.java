import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.oxlang.script.ErrorKind;
import com.oxlang.script.OxError;
import com.oxlang.script.OxScript;
import com.oxlang.script.parser.Value;

public class OxStructTest {

    private static final String SHAPES =
            "struct Point { x, y }\n" +
            "struct RelativePoint inherits Point { cx, cy }\n" +
            "func Point.origin() { return Point(0, 0) }\n" +
            "func Point:sum(self) { return self.x + self.y }\n" +
            "func Point:describe(self) { return \"point\" }\n" +
            "func RelativePoint:describe(this) { return \"relative \" + Point.describe(this) }\n";

    private OxScript ox;

    @BeforeEach
    void setUp() {
        ox = new OxScript();
        ox.run(SHAPES);
    }

    @Test
    void childFieldsFollowParentFields() {
        Value rp = ox.eval("RelativePoint(1, 2, 3, 4)");
        Value.StructInstance inst = rp.asInstance();

        assertEquals(List.of("x", "y", "cx", "cy"), new ArrayList<>(inst.fields.keySet()));
        assertEquals(List.of("x", "y", "cx", "cy"), inst.def.allFields());
        assertEquals(3.0, inst.fields.get("cx").asNumber(), 1e-9);
        assertTrue(inst.def.isSubtypeOf(ox.get("Point").asStructType()));
    }

    @Test
    void inheritedInstanceMethod_resolvesThroughParent() {
        assertEquals(3.0, ox.eval("RelativePoint(1, 2, 3, 4):sum()").asNumber(), 1e-9);
    }

    @Test
    void childMethodOverridesParent() {
        ox.run("p = Point(1, 1)\nrp = RelativePoint(1, 2, 3, 4)");
        assertEquals("point", ox.eval("p:describe()").asString());
        assertEquals("relative point", ox.eval("rp:describe()").asString());
    }

    @Test
    void staticMethod_inheritedByChild() {
        Value o = ox.eval("RelativePoint.origin()");
        assertEquals("Point", o.asInstance().def.name);
        assertEquals(0.0, o.asInstance().fields.get("x").asNumber(), 1e-9);
    }

    @Test
    void dotAccess_bindsInstanceMethods() {
        ox.run("rp = RelativePoint(1, 2, 3, 4)\nm = rp.sum\n");
        assertEquals(Value.Type.FUNCTION, ox.get("m").type);
        assertEquals(3.0, ox.eval("m()").asNumber(), 1e-9);
        assertEquals(3.0, ox.eval("rp.sum()").asNumber(), 1e-9);
        // static methods are reachable from instances too
        assertEquals("Point", ox.eval("rp.origin()").asInstance().def.name);
    }

    @Test
    void fieldWrites() {
        ox.run(
                "rp = RelativePoint(1, 2, 3, 4)\n" +
                "rp.x = 10\n" +
                "rp.cx += 1\n");
        assertEquals(12.0, ox.eval("rp:sum()").asNumber(), 1e-9);
        assertEquals(4.0, ox.eval("rp.cx").asNumber(), 1e-9);

        OxError e = assertThrows(OxError.class, () -> ox.run("rp.z = 1"));
        assertEquals(ErrorKind.NAME, e.kind());
    }

    @Test
    void instancesAreSharedByReference() {
        ox.run(
                "func move(p) { p.x = 99 }\n" +
                "a = Point(1, 2)\n" +
                "move(a)\n");
        assertEquals(99.0, ox.eval("a.x").asNumber(), 1e-9);
        assertTrue(ox.eval("a == a").asBool());
        assertFalse(ox.eval("Point(1, 2) == Point(1, 2)").asBool());
    }

    @Test
    void construction_checksFieldCount() {
        OxError e = assertThrows(OxError.class, () -> ox.run("p = RelativePoint(1, 2)"));
        assertEquals(ErrorKind.ARITY, e.kind());
        assertTrue(e.detail().contains("expects 4"));
        assertEquals(1, e.line());
    }

    @Test
    void unknownMembers_areNameErrors() {
        ox.run("p = Point(1, 2)");
        assertEquals(ErrorKind.NAME, assertThrows(OxError.class, () -> ox.run("p:nope()")).kind());
        assertEquals(ErrorKind.NAME, assertThrows(OxError.class, () -> ox.run("q = p.nope")).kind());
        assertEquals(ErrorKind.NAME, assertThrows(OxError.class, () -> ox.run("Point.nope()")).kind());
    }

    @Test
    void badDeclarations() {
        assertEquals(ErrorKind.NAME,
                assertThrows(OxError.class, () -> ox.run("struct A inherits Missing { a }")).kind());
        assertEquals(ErrorKind.NAME,
                assertThrows(OxError.class, () -> ox.run("func Missing.m() { }")).kind());
        assertEquals(ErrorKind.NAME,
                assertThrows(OxError.class, () -> ox.run("struct Dup inherits Point { x }")).kind());

        ox.run("notAStruct = 3");
        assertEquals(ErrorKind.TYPE,
                assertThrows(OxError.class, () -> ox.run("struct B inherits notAStruct { b }")).kind());
    }

    @Test
    void methodCallOnNonInstance_isTypeError() {
        assertEquals(ErrorKind.TYPE, assertThrows(OxError.class, () -> ox.run("x = 3\nx:sum()")).kind());
    }
}
