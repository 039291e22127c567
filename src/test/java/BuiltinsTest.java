import org.junit.jupiter.api.Test;

import com.unnc.script.UnncScript;
import com.unnc.script.data.PersistentList;
import com.unnc.script.error.ArityException;
import com.unnc.script.error.StructuralTypeException;
import com.unnc.script.parser.Environment;
import com.unnc.script.parser.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BuiltinsTest {

    private static final String LIST_ALGORITHMS = String.join("\n",
            "Algorithm: Length(L)",
            "  if isEmpty(L) then",
            "    return 0",
            "  endif",
            "  return 1 + Length(tail(L))",
            "",
            "Algorithm: Reverse(L)",
            "  let acc = Nil",
            "  while not isEmpty(L) do",
            "    acc ← cons(value(L), acc)",
            "    L ← tail(L)",
            "  endwhile",
            "  return acc",
            "",
            "Algorithm: Append(A, B)",
            "  return merge(A, B)"
    );

    private static final String TREE_ALGORITHMS = String.join("\n",
            "Algorithm: Insert(T, x)",
            "  if isLeaf(T) then",
            "    return node(leaf, x, leaf)",
            "  elseif x < root(T) then",
            "    return node(Insert(left(T), x), root(T), right(T))",
            "  else",
            "    return node(left(T), root(T), Insert(right(T), x))",
            "  endif",
            "",
            "Algorithm: InOrder(T)",
            "  if isLeaf(T) then return Nil endif",
            "  return merge(InOrder(left(T)), cons(root(T), InOrder(right(T))))",
            "",
            "Algorithm: Height(T)",
            "  if isLeaf(T) then return 0 endif",
            "  let l = Height(left(T))",
            "  let r = Height(right(T))",
            "  if l > r then return l + 1 endif",
            "  return r + 1"
    );

    private static Value ints(long... xs) {
        List<Value> items = new ArrayList<>();
        for (long x : xs) items.add(Value.integer(x));
        return Value.list(PersistentList.of(items));
    }

    @Test
    public void listAlgorithms() {
        UnncScript us = new UnncScript();
        Environment env = us.compile(LIST_ALGORITHMS);

        assertEquals(Value.integer(4), us.execute("Length", Arrays.asList(ints(5, 6, 7, 8)), env));
        assertEquals(Value.integer(0), us.execute("Length", Arrays.asList(Value.emptyList()), env));
        assertEquals(ints(3, 2, 1), us.execute("Reverse", Arrays.asList(ints(1, 2, 3)), env));
        assertEquals(ints(1, 2, 3, 4), us.execute("Append", Arrays.asList(ints(1, 2), ints(3, 4)), env));
    }

    @Test
    public void reverseLeavesItsArgumentUnchanged() {
        UnncScript us = new UnncScript();
        Environment env = us.compile(LIST_ALGORITHMS);
        Value input = ints(1, 2, 3);

        us.execute("Reverse", Arrays.asList(input), env);

        assertEquals(ints(1, 2, 3), input);
    }

    @Test
    public void treeAlgorithms() {
        UnncScript us = new UnncScript();
        Environment env = us.compile(TREE_ALGORITHMS);

        Value t = Value.leaf();
        for (long x : new long[] { 5, 3, 8, 1, 4, 9 }) {
            t = us.execute("Insert", Arrays.asList(t, Value.integer(x)), env);
        }

        assertEquals(6, t.asTree().size());
        assertEquals(Value.integer(5), t.asTree().root());
        assertEquals(ints(1, 3, 4, 5, 8, 9), us.execute("InOrder", Arrays.asList(t), env));
        assertEquals(Value.integer(3), us.execute("Height", Arrays.asList(t), env));
    }

    @Test
    public void insertSharesUntouchedSubtrees() {
        UnncScript us = new UnncScript();
        Environment env = us.compile(TREE_ALGORITHMS);
        Value t = us.evaluate("node(node(leaf, 1, leaf), 5, node(leaf, 9, leaf))", env);

        Value t2 = us.execute("Insert", Arrays.asList(t, Value.integer(7)), env);

        assertSame(t.asTree().left(), t2.asTree().left());
        assertEquals(3, t.asTree().size());
        assertEquals(4, t2.asTree().size());
    }

    @Test
    public void consValueTailLaws() {
        UnncScript us = new UnncScript();
        Environment env = us.compile("");
        env.setGlobal("L", ints(2, 3));

        assertEquals(Value.integer(1), us.evaluate("value(cons(1, L))", env));
        assertEquals(ints(2, 3), us.evaluate("tail(cons(1, L))", env));
        assertEquals(Value.bool(false), us.evaluate("isEmpty(cons(1, L))", env));
        assertEquals(Value.bool(true), us.evaluate("isEmpty(Nil)", env));
    }

    @Test
    public void mergeLaws() {
        UnncScript us = new UnncScript();
        Environment env = us.compile("");
        env.setGlobal("A", ints(1));
        env.setGlobal("B", ints(2, 3));
        env.setGlobal("C", ints(4));

        assertEquals(us.evaluate("merge(merge(A, B), C)", env), us.evaluate("merge(A, merge(B, C))", env));
        assertEquals(ints(2, 3), us.evaluate("merge(Nil, B)", env));
        assertEquals(ints(2, 3), us.evaluate("merge(B, Nil)", env));
    }

    @Test
    public void treeLaws() {
        UnncScript us = new UnncScript();
        Environment env = us.compile("");
        env.setGlobal("l", us.evaluate("node(leaf, 1, leaf)", env));
        env.setGlobal("r", us.evaluate("node(node(leaf, 3, leaf), 4, leaf)", env));

        assertEquals(Value.integer(4), us.evaluate("size(node(l, 2, r))", env));
        assertEquals(Value.integer(2), us.evaluate("root(node(l, 2, r))", env));
        assertEquals(env.getGlobal("l"), us.evaluate("left(node(l, 2, r))", env));
        assertEquals(env.getGlobal("r"), us.evaluate("right(node(l, 2, r))", env));
        assertEquals(Value.integer(0), us.evaluate("size(leaf)", env));
        assertEquals(Value.bool(true), us.evaluate("isLeaf(leaf)", env));
        assertEquals(Value.bool(false), us.evaluate("isLeaf(l)", env));
    }

    @Test
    public void isLeafAndIsEmptyAcceptAnyValue() {
        UnncScript us = new UnncScript();
        Environment env = us.compile("");

        assertEquals(Value.bool(false), us.evaluate("isLeaf(3)", env));
        assertEquals(Value.bool(false), us.evaluate("isEmpty(leaf)", env));
    }

    @Test
    public void structuralMisuse() {
        UnncScript us = new UnncScript();
        Environment env = us.compile("");

        StructuralTypeException e = assertThrows(StructuralTypeException.class,
                () -> us.evaluate("root(leaf)", env));
        assertTrue(e.getMessage().contains("leaf"), e.getMessage());
        assertThrows(StructuralTypeException.class, () -> us.evaluate("tail(Nil)", env));
        assertThrows(StructuralTypeException.class, () -> us.evaluate("node(1, 2, leaf)", env));
        assertThrows(StructuralTypeException.class, () -> us.evaluate("merge(Nil, leaf)", env));
        assertThrows(StructuralTypeException.class, () -> us.evaluate("size(Nil)", env));
    }

    @Test
    public void builtinArity() {
        UnncScript us = new UnncScript();
        Environment env = us.compile("");

        assertThrows(ArityException.class, () -> us.evaluate("node(leaf, 1)", env));
        assertThrows(ArityException.class, () -> us.evaluate("Nil(1)", env));
        assertThrows(ArityException.class, () -> us.evaluate("size(leaf, leaf)", env));
    }

    @Test
    public void registeredFunctionIsCallable() {
        UnncScript us = new UnncScript();
        us.registerFunction("twice", args -> Value.integer(args.get(0).asInt() * 2));
        Value v = us.run("Algorithm: Go(n)\n  return twice(n) + 1", "Go", Arrays.asList(Value.integer(4)));
        assertEquals(Value.integer(9), v);
    }

    @Test
    public void builtinsTakePrecedenceOverAlgorithms() {
        UnncScript us = new UnncScript();
        Environment env = us.compile(String.join("\n",
                "Algorithm: size(T)",
                "  return 99",
                "",
                "Algorithm: Probe()",
                "  return size(leaf)"
        ));
        assertEquals(Value.integer(0), us.execute("Probe", Collections.emptyList(), env));
    }
}
