import org.junit.jupiter.api.Test;

import com.unnc.script.parser.OperatorNormalizer;

import static org.junit.jupiter.api.Assertions.*;

public class OperatorNormalizerTest {

    @Test
    public void wordOperators() {
        assertEquals("a % 2 == 0 && b || ! c", OperatorNormalizer.normalize("a mod 2 == 0 AND b or NOT c"));
    }

    @Test
    public void unicodeOperators() {
        assertEquals("a <= b && c >= d && e != f", OperatorNormalizer.normalize("a ≤ b and c ≥ d and e ≠ f"));
        assertEquals("2 * 3", OperatorNormalizer.normalize("2 × 3"));
    }

    @Test
    public void standaloneXIsMultiplication() {
        assertEquals("n * 2", OperatorNormalizer.normalize("n X 2"));
    }

    @Test
    public void identifiersContainingOperatorWordsSurvive() {
        assertEquals("model + Xs + order + android", OperatorNormalizer.normalize("model + Xs + order + android"));
    }

    @Test
    public void quotedTextIsLeftAlone() {
        assertEquals("'cats and dogs' + x", OperatorNormalizer.normalize("'cats and dogs' + x"));
        assertEquals("\"a;b\" + 1", OperatorNormalizer.normalize("\"a;b\" + 1;"));
    }

    @Test
    public void semicolonsAreDropped() {
        assertEquals("x + 1", OperatorNormalizer.normalize("x + 1;"));
    }
}
