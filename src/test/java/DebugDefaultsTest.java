import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.oxlang.debug.Debug;
import com.oxlang.debug.DebugLevel;
import com.oxlang.script.ErrorKind;
import com.oxlang.script.OxError;
import com.oxlang.script.OxScript;

/** The engine must log safely before any host installs a sink. */
public class DebugDefaultsTest {

    @Test
    void defaultSink_isInstalled() {
        assertNotNull(Debug.get().getSink());
        Debug.get().log(DebugLevel.ERROR, "test", "no sink installed", null);
    }

    @Test
    void importAndErrors_workWithDefaultSink() {
        OxScript ox = new OxScript();
        ox.run("import std.math\ny = abs(-2)");
        assertEquals(2.0, ox.get("y").asNumber(), 1e-9);

        OxError e = assertThrows(OxError.class, () -> ox.run("z = missing"));
        assertEquals(ErrorKind.NAME, e.kind());
    }
}
