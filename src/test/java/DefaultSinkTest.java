import org.junit.jupiter.api.Test;

import com.unnc.debug.Debug;
import com.unnc.script.UnncScript;
import com.unnc.script.parser.Value;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/** Uses the engine without ever installing a debug sink. */
public class DefaultSinkTest {

    @Test
    public void hubHasASinkBeforeAnyIsInstalled() {
        assertNotNull(Debug.get().getSink());
        Debug.get().d("unnc.test", "dropped");
    }

    @Test
    public void compileAndRunLogWithoutASink() {
        Value v = new UnncScript().run(String.join("\n",
                "Algorithm: F(n)",
                "  1: let s = n",
                "  2: return s"
        ), "F", Arrays.asList(Value.integer(4)));

        assertEquals(Value.integer(4), v);
    }

    @Test
    public void warningsAndSuppressedStatementsLogWithoutASink() {
        Value v = new UnncScript().run(String.join("\n",
                "stray preamble",
                "Algorithm: G()",
                "  this is not valid",
                "  if True then",
                "    let x = 1",
                "  return x"
        ), "G", Arrays.asList());

        assertEquals(Value.integer(1), v);
    }
}
