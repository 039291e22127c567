import org.junit.jupiter.api.Test;

import com.unnc.script.UnncScript;
import com.unnc.script.error.ArityException;
import com.unnc.script.error.EvaluationException;
import com.unnc.script.error.NameResolutionException;
import com.unnc.script.error.StructuralTypeException;
import com.unnc.script.parser.Environment;
import com.unnc.script.parser.Value;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionEvaluatorTest {

    private final UnncScript us = new UnncScript();
    private final Environment env = us.compile("");

    private Value eval(String expr) {
        return us.evaluate(expr, env);
    }

    @Test
    public void divisionAlwaysYieldsFloat() {
        Value v = eval("7 / 2");
        assertEquals(Value.Type.FLOAT, v.type);
        assertEquals(3.5, v.asDouble(), 1e-12);

        Value exact = eval("6 / 3");
        assertEquals(Value.Type.FLOAT, exact.type);
        assertEquals(2.0, exact.asDouble(), 1e-12);
    }

    @Test
    public void integerArithmeticStaysIntegral() {
        Value v = eval("2 + 3 * 4 - 1");
        assertEquals(Value.Type.INT, v.type);
        assertEquals(13L, v.asInt());
        assertEquals(Value.integer(20), eval("(2 + 3) * 4"));
    }

    @Test
    public void modFollowsTheDivisorSign() {
        assertEquals(Value.integer(2), eval("-7 mod 3"));
        assertEquals(Value.integer(1), eval("7 % 3"));
        assertEquals(Value.integer(-2), eval("7 mod -3"));
    }

    @Test
    public void wordAndSymbolOperators() {
        assertEquals(Value.integer(6), eval("2 X 3"));
        assertEquals(Value.integer(6), eval("2 × 3"));
        assertEquals(Value.bool(true), eval("3 ≥ 3"));
        assertEquals(Value.bool(true), eval("1 ≠ 2"));
        assertEquals(Value.bool(false), eval("not True"));
    }

    @Test
    public void comparisonsChain() {
        assertEquals(Value.bool(true), eval("1 < 2 < 3"));
        assertEquals(Value.bool(false), eval("1 < 3 < 2"));
        assertEquals(Value.bool(true), eval("1 == 1.0"));
        assertEquals(Value.bool(true), eval("'abc' < 'abd'"));
    }

    @Test
    public void mixedComparisonFails() {
        assertThrows(EvaluationException.class, () -> eval("1 < 'a'"));
    }

    @Test
    public void logicalOperatorsReturnTheDecidingOperand() {
        assertEquals(Value.integer(5), eval("True and 5"));
        assertEquals(Value.integer(0), eval("0 and 5"));
        assertEquals(Value.integer(7), eval("0 or 7"));
        assertEquals(Value.bool(true), eval("1 < 2 && 2 < 3"));
    }

    @Test
    public void plusConcatenatesWhenEitherSideIsAString() {
        assertEquals(Value.string("ab"), eval("'a' + \"b\""));
        assertEquals(Value.string("n=3"), eval("'n=' + 3"));
    }

    @Test
    public void globalsAreVisibleInExpressions() {
        env.setGlobal("model", Value.integer(10));
        assertEquals(Value.integer(1), eval("model mod 3"));
        assertEquals(Value.integer(10), eval("model"));
    }

    @Test
    public void identifiersContainingOperatorWordsSurvive() {
        env.setGlobal("modX", Value.integer(4));
        env.setGlobal("Xmod", Value.integer(3));
        assertEquals(Value.integer(12), eval("modX * Xmod"));
    }

    @Test
    public void divisionByZeroIsAnEvaluationError() {
        assertThrows(EvaluationException.class, () -> eval("1 / 0"));
        assertThrows(EvaluationException.class, () -> eval("1 mod 0"));
    }

    @Test
    public void undefinedNameInsideExpressionIsAnEvaluationError() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("1 + undefinedThing"));
        assertTrue(e.getMessage().contains("undefinedThing"), e.getMessage());
    }

    @Test
    public void evaluationErrorCarriesBothTextsAndTheCause() {
        env.setGlobal("a", Value.integer(5));
        env.setGlobal("b", Value.integer(1));

        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("a mod 0 AND b"));

        assertEquals("a mod 0 AND b", e.originalText());
        assertEquals("a % 0 && b", e.normalizedText());
        assertTrue(e.getCause() instanceof ArithmeticException, String.valueOf(e.getCause()));
    }

    @Test
    public void evaluationErrorForUnknownNameAfterNormalization() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("1 X undefinedThing;"));

        assertEquals("1 X undefinedThing;", e.originalText());
        assertEquals("1 * undefinedThing", e.normalizedText());
        assertTrue(e.getCause() instanceof NameResolutionException, String.valueOf(e.getCause()));
        assertEquals("undefinedThing", ((NameResolutionException) e.getCause()).name());
    }

    @Test
    public void functionNameUsedAsValueIsRejected() {
        EvaluationException e = assertThrows(EvaluationException.class, () -> eval("1 + size"));
        assertTrue(e.getMessage().contains("is a function"), e.getMessage());
    }

    @Test
    public void constantCannotBeCalled() {
        NameResolutionException e = assertThrows(NameResolutionException.class, () -> eval("leaf(1)"));
        assertTrue(e.getMessage().contains("cannot be called"), e.getMessage());
    }

    @Test
    public void structuralErrorsKeepTheirType() {
        assertThrows(StructuralTypeException.class, () -> eval("cons(1, 2)"));
        assertThrows(StructuralTypeException.class, () -> eval("1 + size(cons(1, 2))"));
        assertThrows(StructuralTypeException.class, () -> eval("value(Nil)"));
    }

    @Test
    public void arityAndUnknownCallee() {
        ArityException a = assertThrows(ArityException.class, () -> eval("cons(1)"));
        assertEquals(2, a.expected());
        assertEquals(1, a.actual());

        NameResolutionException n = assertThrows(NameResolutionException.class, () -> eval("unknownFn(3)"));
        assertEquals("unknownFn", n.name());
    }

    @Test
    public void constantsAndNil() {
        assertTrue(eval("leaf").isLeaf());
        assertTrue(eval("Nil").isEmptyList());
        assertTrue(eval("Nil()").isEmptyList());
    }

    @Test
    public void listLiteralsAndNestedCalls() {
        Value list = eval("[1, 2, 3]");
        assertTrue(list.isList());
        assertEquals(3, list.asList().length());
        assertEquals(Value.integer(1), list.asList().value());

        assertEquals(Value.integer(3), eval("size(node(node(leaf, 1, leaf), 2, node(leaf, 3, leaf)))"));
        assertEquals(Value.integer(2), eval("value(tail(cons(1, cons(2, Nil))))"));
    }

    @Test
    public void callsInsideArithmetic() {
        assertEquals(Value.integer(4), eval("size(node(leaf, 1, leaf)) + 3"));
        assertEquals(Value.bool(true), eval("isEmpty(Nil) and isLeaf(leaf)"));
    }
}
