import org.junit.jupiter.api.Test;

import com.unnc.script.data.PersistentTree;
import com.unnc.script.error.StructuralTypeException;

import static org.junit.jupiter.api.Assertions.*;

public class PersistentTreeTest {

    private static PersistentTree<Integer> single(int v) {
        return PersistentTree.node(PersistentTree.leaf(), v, PersistentTree.leaf());
    }

    @Test
    public void sizes() {
        assertEquals(0, PersistentTree.leaf().size());
        assertEquals(1, single(5).size());
        assertEquals(3, PersistentTree.node(single(1), 2, single(3)).size());
    }

    @Test
    public void accessors() {
        PersistentTree<Integer> left = single(1);
        PersistentTree<Integer> right = single(3);
        PersistentTree<Integer> t = PersistentTree.node(left, 2, right);

        assertFalse(t.isLeaf());
        assertEquals(2, t.root());
        assertSame(left, t.left());
        assertSame(right, t.right());
    }

    @Test
    public void accessorsFailOnLeaf() {
        PersistentTree<Integer> leaf = PersistentTree.leaf();
        assertTrue(leaf.isLeaf());
        assertThrows(StructuralTypeException.class, leaf::root);
        assertThrows(StructuralTypeException.class, leaf::left);
        assertThrows(StructuralTypeException.class, leaf::right);
    }

    @Test
    public void structuralEquality() {
        assertEquals(PersistentTree.node(single(1), 2, PersistentTree.leaf()),
                PersistentTree.node(single(1), 2, PersistentTree.leaf()));
        assertNotEquals(PersistentTree.node(single(1), 2, PersistentTree.leaf()),
                PersistentTree.node(PersistentTree.leaf(), 2, single(1)));
        assertEquals("node(leaf, 5, leaf)", single(5).toString());
    }
}
