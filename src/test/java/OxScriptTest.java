import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.oxlang.script.OxScript;
import com.oxlang.script.parser.RunResult;
import com.oxlang.script.parser.Value;

public class OxScriptTest {

    private static Value v(Map<String, Value> env, String name) {
        Value val = env.get(name);
        assertNotNull(val, "Expected variable in env: " + name);
        return val;
    }

    @Test
    void arithmetic_precedence() {
        OxScript ox = new OxScript();
        Map<String, Value> env = ox.run(
                "a = 2 + 3 * 4\n" +
                "b = (2 + 3) * 4\n" +
                "c = 2 ^ 3 ^ 2\n" +
                "d = -2 ^ 2\n" +
                "e = 7 / 2\n" +
                "f = 10 - 4 - 3\n"
        ).globals();

        assertEquals(14.0, v(env, "a").asNumber(), 1e-9);
        assertEquals(20.0, v(env, "b").asNumber(), 1e-9);
        assertEquals(512.0, v(env, "c").asNumber(), 1e-9);
        assertEquals(4.0, v(env, "d").asNumber(), 1e-9);
        assertEquals(3.5, v(env, "e").asNumber(), 1e-9);
        assertEquals(3.0, v(env, "f").asNumber(), 1e-9);
    }

    @Test
    void stringConcatenationAndComparison() {
        OxScript ox = new OxScript();
        Map<String, Value> env = ox.run(
                "s = \"ab\" + 'cd'\n" +
                "lt = \"apple\" < \"banana\"\n" +
                "eq = s == \"abcd\"\n"
        ).globals();

        assertEquals("abcd", v(env, "s").asString());
        assertTrue(v(env, "lt").asBool());
        assertTrue(v(env, "eq").asBool());
    }

    @Test
    void run_returnsLastExpressionValue() {
        OxScript ox = new OxScript();
        RunResult r = ox.run("x = 2\nx * 21");
        assertEquals(42.0, r.value().asNumber(), 1e-9);

        assertTrue(ox.run("y = 1").value().isNil());
        assertEquals(3.0, ox.eval("x + y").asNumber(), 1e-9);
    }

    @Test
    void ifElseChain() {
        OxScript ox = new OxScript();
        ox.run(
                "func classify(n) {\n" +
                "  if n < 0 {\n" +
                "    return \"neg\"\n" +
                "  } else if n == 0 {\n" +
                "    return \"zero\"\n" +
                "  } else {\n" +
                "    return \"pos\"\n" +
                "  }\n" +
                "}\n");

        assertEquals("neg", ox.call("classify", Value.number(-3)).asString());
        assertEquals("zero", ox.call("classify", Value.number(0)).asString());
        assertEquals("pos", ox.call("classify", Value.number(9)).asString());
    }

    @Test
    void whileWithBreakAndContinue() {
        OxScript ox = new OxScript();
        Map<String, Value> env = ox.run(
                "total = 0\n" +
                "i = 0\n" +
                "while true {\n" +
                "  i += 1\n" +
                "  if i > 9 { break }\n" +
                "  if i == 4 { continue }\n" +
                "  total += i\n" +
                "}\n"
        ).globals();

        assertEquals(41.0, v(env, "total").asNumber(), 1e-9);
        assertEquals(10.0, v(env, "i").asNumber(), 1e-9);
    }

    @Test
    void cStyleFor_loopVariableStaysLocal() {
        OxScript ox = new OxScript();
        Map<String, Value> env = ox.run(
                "s = 0\n" +
                "for i = 0, i < 5, i += 1 {\n" +
                "  if i == 2 { continue }\n" +
                "  s += i\n" +
                "}\n"
        ).globals();

        assertEquals(8.0, v(env, "s").asNumber(), 1e-9);
        assertFalse(ox.has("i"));
    }

    @Test
    void forIn_overArrayAndString() {
        OxScript ox = new OxScript();
        Map<String, Value> env = ox.run(
                "arr = [1, 2, 3]\n" +
                "sum = 0\n" +
                "for x in arr {\n" +
                "  sum += x\n" +
                "  arr += 0\n" +
                "}\n" +
                "letters = []\n" +
                "for c in \"abc\" { letters += c }\n"
        ).globals();

        // the loop walks a snapshot, appends during iteration are not visited
        assertEquals(6.0, v(env, "sum").asNumber(), 1e-9);
        assertEquals(6, v(env, "arr").asArray().size());
        assertEquals(3, v(env, "letters").asArray().size());
        assertEquals("c", v(env, "letters").asArray().get(2).asString());
    }

    @Test
    void arrayPlusEquals_appendsOneElement() {
        OxScript ox = new OxScript();
        List<Value> a = ox.run(
                "a = [1]\n" +
                "a += 2\n" +
                "a += [3, 4]\n"
        ).globals().get("a").asArray();

        assertEquals(3, a.size());
        assertEquals(2.0, a.get(1).asNumber(), 1e-9);
        assertEquals(2, a.get(2).asArray().size());
    }

    @Test
    void indexReadAndWrite() {
        OxScript ox = new OxScript();
        Map<String, Value> env = ox.run(
                "a = [1, 2]\n" +
                "a[2] = 3\n" +
                "a[0] = 9\n" +
                "a[1] *= 10\n" +
                "first = a[0]\n" +
                "ch = \"hey\"[1]\n"
        ).globals();

        List<Value> a = v(env, "a").asArray();
        assertEquals(3, a.size());
        assertEquals(9.0, a.get(0).asNumber(), 1e-9);
        assertEquals(20.0, a.get(1).asNumber(), 1e-9);
        assertEquals(3.0, a.get(2).asNumber(), 1e-9);
        assertEquals(9.0, v(env, "first").asNumber(), 1e-9);
        assertEquals("e", v(env, "ch").asString());
    }

    @Test
    void assignmentInsideFunction_doesNotLeakGlobals() {
        OxScript ox = new OxScript();
        ox.run(
                "counter = 0\n" +
                "func inc() {\n" +
                "  counter += 1\n" +
                "  local = 5\n" +
                "  return local\n" +
                "}\n" +
                "inc()\n" +
                "r = inc()\n");

        assertEquals(2.0, ox.get("counter").asNumber(), 1e-9);
        assertEquals(5.0, ox.get("r").asNumber(), 1e-9);
        assertFalse(ox.has("local"));
    }

    @Test
    void plainAssignmentInsideFunction_shadowsGlobal() {
        OxScript ox = new OxScript();
        ox.run(
                "total = 99\n" +
                "func sum(a) {\n" +
                "  total = 0\n" +
                "  for x in a { total += x }\n" +
                "  return total\n" +
                "}\n" +
                "s = sum([1, 2])\n");

        assertEquals(3.0, ox.get("s").asNumber(), 1e-9);
        assertEquals(99.0, ox.get("total").asNumber(), 1e-9);
    }

    @Test
    void plainAssignmentInsideClosure_rebindsEnclosingLocal() {
        OxScript ox = new OxScript();
        ox.run(
                "func counter() {\n" +
                "  n = 0\n" +
                "  func next() {\n" +
                "    n = n + 1\n" +
                "    return n\n" +
                "  }\n" +
                "  return next\n" +
                "}\n" +
                "c = counter()\n" +
                "c()\n" +
                "r = c()\n");

        assertEquals(2.0, ox.get("r").asNumber(), 1e-9);
        assertFalse(ox.has("n"));
    }

    @Test
    void selfContainingArray_displaysAndComparesWithoutOverflow() {
        OxScript ox = new OxScript();
        ox.run("a = [1]\na += a\nsame = a == a\nb = [1]\nb += b\nalso = a == b\n");

        assertEquals("[1, [...]]", ox.get("a").display());
        assertEquals("[1.0, [...]]", ox.get("a").toString());
        assertTrue(ox.get("same").asBool());
        assertTrue(ox.get("also").asBool());
    }

    @Test
    void closuresCaptureDefiningScope() {
        OxScript ox = new OxScript();
        ox.run(
                "func make(n) {\n" +
                "  func add(x) { return x + n }\n" +
                "  return add\n" +
                "}\n" +
                "add5 = make(5)\n" +
                "add7 = make(7)\n" +
                "r = add5(10) + add7(0)\n");

        assertEquals(22.0, ox.get("r").asNumber(), 1e-9);
    }

    @Test
    void recursion_factorial() {
        OxScript ox = new OxScript();
        ox.run(
                "func fact(n) {\n" +
                "  if n <= 1 { return 1 }\n" +
                "  return n * fact(n - 1)\n" +
                "}\n" +
                "r = fact(5)\n");

        assertEquals(120.0, ox.get("r").asNumber(), 1e-9);
        assertEquals(720.0, ox.call("fact", Value.number(6)).asNumber(), 1e-9);
    }

    @Test
    void logicalOperatorsShortCircuit() {
        OxScript ox = new OxScript();
        Map<String, Value> env = ox.run(
                "a = false && missing()\n" +
                "b = true || missing()\n" +
                "c = !(1 < 2) || 2 >= 2\n"
        ).globals();

        assertFalse(v(env, "a").asBool());
        assertTrue(v(env, "b").asBool());
        assertTrue(v(env, "c").asBool());
    }

    @Test
    void nilComparesWithAnything() {
        OxScript ox = new OxScript();
        Map<String, Value> env = ox.run(
                "func nothing() { }\n" +
                "x = nothing()\n" +
                "a = x == nil\n" +
                "b = 1 == nil\n" +
                "c = \"s\" != nil\n"
        ).globals();

        assertTrue(v(env, "x").isNil());
        assertTrue(v(env, "a").asBool());
        assertFalse(v(env, "b").asBool());
        assertTrue(v(env, "c").asBool());
    }

    @Test
    void arraysCompareElementWise() {
        OxScript ox = new OxScript();
        assertTrue(ox.eval("[1, \"a\", [2]] == [1, \"a\", [2]]").asBool());
        assertFalse(ox.eval("[1, 2] == [1, 2, 3]").asBool());
    }

    @Test
    void hostFunctions_areCallableAndSurviveReset() {
        OxScript ox = new OxScript();
        ox.registerFunction("twice", args -> Value.number(args.get(0).asNumber() * 2));

        assertEquals(8.0, ox.eval("twice(4)").asNumber(), 1e-9);

        ox.run("leftover = 1");
        ox.reset();

        assertFalse(ox.has("leftover"));
        assertEquals(6.0, ox.eval("twice(3)").asNumber(), 1e-9);
    }

    @Test
    void globalsPersistAcrossRuns() {
        OxScript ox = new OxScript();
        ox.run("func sq(x) { return x * x }");
        ox.run("n = sq(7)");
        assertEquals(49.0, ox.get("n").asNumber(), 1e-9);
    }
}
