import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.unnc.debug.Debug;
import com.unnc.debug.DebugLevel;
import com.unnc.protocol.CaseLoader;
import com.unnc.protocol.CaseSpec;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CaseLoaderTest {

    private final CaseLoader loader = new CaseLoader();
    private CapturingDebugSink sink;

    @BeforeEach
    public void installSink() {
        sink = new CapturingDebugSink();
        Debug.get().setSink(sink);
    }

    @AfterEach
    public void resetSink() {
        Debug.get().setSink(null);
    }

    @Test
    public void wholeFileCasesObject() {
        List<CaseSpec> cases = loader.parse(
                "{\"cases\": [{\"algo\": \"Sum\", \"args\": [[1, 2]]}, {\"type\": \"dsl_expr\", \"expr\": \"1 + 1\"}]}");

        assertEquals(2, cases.size());
        assertEquals(CaseSpec.Kind.INVOKE, cases.get(0).kind);
        assertEquals("Sum", cases.get(0).algorithm);
        assertTrue(cases.get(0).args.get(0).isArray());
        assertEquals(CaseSpec.Kind.EXPRESSION, cases.get(1).kind);
        assertEquals("1 + 1", cases.get(1).expression);
    }

    @Test
    public void wholeFileArrayWithByteOrderMark() {
        List<CaseSpec> cases = loader.parse("\uFEFF[{\"algo\": \"A\", \"args\": []}, {\"type\": \"var_assign\", \"var\": \"t\", \"value\": \"leaf\"}]");

        assertEquals(2, cases.size());
        assertEquals("A", cases.get(0).algorithm);
        assertEquals(CaseSpec.Kind.ASSIGN, cases.get(1).kind);
        assertEquals("t", cases.get(1).variable);
        assertEquals("leaf", cases.get(1).expression);
    }

    @Test
    public void lineBasedListing() {
        List<CaseSpec> cases = loader.parse(String.join("\n",
                "# list helpers",
                "Sum: [1, 2, 3]",
                "",
                "t = node(leaf, 2, leaf)",
                "{\"algo\": \"Size\", \"args\": [\"t\"], \"store\": \"s\"}",
                "Pair: 1, \"two\""
        ));

        assertEquals(4, cases.size());

        CaseSpec sum = cases.get(0);
        assertEquals("Sum", sum.algorithm);
        assertEquals(1, sum.args.size());
        assertEquals(3, sum.args.get(0).size());

        CaseSpec assign = cases.get(1);
        assertEquals(CaseSpec.Kind.ASSIGN, assign.kind);
        assertEquals("t", assign.variable);
        assertEquals("node(leaf, 2, leaf)", assign.expression);

        CaseSpec json = cases.get(2);
        assertEquals("Size", json.algorithm);
        assertEquals("s", json.store);

        CaseSpec pair = cases.get(3);
        assertEquals(2, pair.args.size());
        assertEquals(1, pair.args.get(0).intValue());
        assertEquals("two", pair.args.get(1).textValue());
    }

    @Test
    public void callFormSpanningLines() {
        List<CaseSpec> cases = loader.parse(String.join("\n",
                "Insert(node(leaf, 5, leaf),",
                "       3)",
                "Length([1, 2])"
        ));

        assertEquals(2, cases.size());
        CaseSpec insert = cases.get(0);
        assertEquals("Insert", insert.algorithm);
        assertEquals(2, insert.args.size());
        assertEquals("node(leaf, 5, leaf)", insert.args.get(0).textValue());
        assertEquals(3, insert.args.get(1).intValue());

        assertEquals("Length", cases.get(1).algorithm);
        assertTrue(cases.get(1).args.get(0).isArray());
    }

    @Test
    public void colonFormSpanningLines() {
        List<CaseSpec> cases = loader.parse(String.join("\n",
                "Sum: [1,",
                "      2,",
                "      3]"
        ));

        assertEquals(1, cases.size());
        assertEquals(3, cases.get(0).args.get(0).size());
    }

    @Test
    public void expressionLine() {
        List<CaseSpec> cases = loader.parse("size(node(leaf, 1, leaf)) == 1\nn == 1");
        assertEquals(2, cases.size());
        assertEquals(CaseSpec.Kind.EXPRESSION, cases.get(0).kind);
        assertEquals("size(node(leaf, 1, leaf)) == 1", cases.get(0).expression);
        assertEquals(CaseSpec.Kind.EXPRESSION, cases.get(1).kind);
    }

    @Test
    public void unknownLineIsSkippedWithWarning() {
        List<CaseSpec> cases = loader.parse("??? what\nA: 1");

        assertEquals(1, cases.size());
        assertTrue(sink.contains(DebugLevel.WARN, "not understood"), sink.entries.toString());
    }

    @Test
    public void nonObjectJsonCaseIsInvalid() {
        List<CaseSpec> cases = loader.parse("[1, {\"algo\": \"A\"}]");

        assertEquals(CaseSpec.Kind.INVALID, cases.get(0).kind);
        assertEquals(CaseSpec.Kind.INVOKE, cases.get(1).kind);
        assertTrue(cases.get(1).args.isEmpty());
    }

    @Test
    public void fileReferences(@TempDir Path dir) throws Exception {
        Path ref = dir.resolve("one.json");
        Files.writeString(ref, "{\"algo\": \"Ref\", \"args\": [1]}", StandardCharsets.UTF_8);
        Path input = dir.resolve("input.in");
        Files.writeString(input, "@" + ref + "\n@" + dir.resolve("missing.json") + "\n", StandardCharsets.UTF_8);

        List<CaseSpec> cases = loader.loadFile(input);

        assertEquals(1, cases.size());
        assertEquals("Ref", cases.get(0).algorithm);
        assertTrue(sink.contains(DebugLevel.WARN, "not found"), sink.entries.toString());
    }

    @Test
    public void missingInputFileHasNoCases(@TempDir Path dir) throws Exception {
        assertTrue(loader.loadFile(dir.resolve("absent.in")).isEmpty());
    }

    @Test
    public void execValues() {
        CaseSpec colon = loader.parseExec("Reverse: [1, 2, 3]");
        assertEquals("Reverse", colon.algorithm);
        assertEquals(3, colon.args.get(0).size());

        CaseSpec json = loader.parseExec("{\"type\": \"dsl_expr\", \"expr\": \"1 + 2\"}");
        assertEquals(CaseSpec.Kind.EXPRESSION, json.kind);

        assertNull(loader.parseExec("just words"));
    }

    @Test
    public void caseJsonFormIsACopy() {
        CaseSpec c = loader.parseExec("Sum: [1, 2]");
        assertEquals("Sum", c.toJson().get("algo").asText());
        assertEquals(1, c.toJson().get("args").size());
    }
}
