import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.unnc.debug.Debug;
import com.unnc.debug.DebugLevel;
import com.unnc.script.UnncScript;
import com.unnc.script.error.StructuralTypeException;
import com.unnc.script.parser.Environment;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @AfterEach
    public void resetSink() {
        Debug.get().setSink(null);
    }

    @Test
    public void printingSinkFiltersByThreshold() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        Debug.get().setSink(Debug.printing(out, DebugLevel.WARN));

        Debug.get().d("t", "hidden");
        Debug.get().w("t", "shown");
        Debug.get().e("t", "failed", new IllegalStateException("x"));

        String text = bytes.toString(StandardCharsets.UTF_8);
        assertFalse(text.contains("hidden"));
        assertTrue(text.contains("[WARN] t: shown"));
        assertTrue(text.contains("[ERROR] t: failed"));
        assertFalse(text.contains("IllegalStateException"));
    }

    @Test
    public void nullSinkFallsBackToNoop() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());
        Debug.get().i("t", "goes nowhere");
    }

    @Test
    public void levelParsing() {
        assertEquals(DebugLevel.INFO, DebugLevel.parse("info", DebugLevel.WARN));
        assertEquals(DebugLevel.WARN, DebugLevel.parse("loud", DebugLevel.WARN));
        assertTrue(DebugLevel.ERROR.atLeast(DebugLevel.WARN));
        assertFalse(DebugLevel.DEBUG.atLeast(DebugLevel.INFO));
    }

    @Test
    public void interpreterTracesCalls() {
        CapturingDebugSink sink = new CapturingDebugSink();
        Debug.get().setSink(sink);

        new UnncScript().run("Algorithm: A()\n  return 1", "A", Collections.emptyList());

        assertTrue(sink.contains(DebugLevel.TRACE, "enter A"), sink.entries.toString());
    }

    @Test
    public void failingInvocationLogsTheCallChain() {
        CapturingDebugSink sink = new CapturingDebugSink();
        Debug.get().setSink(sink);
        UnncScript us = new UnncScript();
        Environment env = us.compile(String.join("\n",
                "Algorithm: Outer()",
                "  return Inner(Nil)",
                "",
                "Algorithm: Inner(L)",
                "  return value(L)"
        ));

        assertThrows(StructuralTypeException.class, () -> us.execute("Outer", Collections.emptyList(), env));

        assertTrue(sink.contains(DebugLevel.DEBUG, "Outer failed in Inner <- Outer"), sink.entries.toString());
    }
}
