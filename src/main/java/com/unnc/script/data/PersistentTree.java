package com.unnc.script.data;

import java.util.Objects;

import com.unnc.script.error.StructuralTypeException;

/**
 * Immutable binary tree: either {@link Leaf} or {@link Node}. Building a node never touches its
 * children.
 */
public abstract class PersistentTree<E> {

    private static final Leaf<?> LEAF = new Leaf<>();

    private PersistentTree() {}

    @SuppressWarnings("unchecked")
    public static <E> PersistentTree<E> leaf() {
        return (PersistentTree<E>) LEAF;
    }

    public static <E> PersistentTree<E> node(PersistentTree<E> left, E value, PersistentTree<E> right) {
        return new Node<>(Objects.requireNonNull(left, "left"), value, Objects.requireNonNull(right, "right"));
    }

    public abstract boolean isLeaf();

    public abstract E root();

    public abstract PersistentTree<E> left();

    public abstract PersistentTree<E> right();

    /** Number of nodes; 0 for a leaf. */
    public abstract int size();

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistentTree)) return false;
        PersistentTree<?> other = (PersistentTree<?>) o;
        if (isLeaf() || other.isLeaf()) return isLeaf() && other.isLeaf();
        return size() == other.size()
                && Objects.equals(root(), other.root())
                && left().equals(other.left())
                && right().equals(other.right());
    }

    @Override
    public int hashCode() {
        if (isLeaf()) return 0;
        return Objects.hash(left(), root(), right());
    }

    @Override
    public String toString() {
        if (isLeaf()) return "leaf";
        return "node(" + left() + ", " + root() + ", " + right() + ")";
    }

    public static final class Leaf<E> extends PersistentTree<E> {
        private Leaf() {}

        @Override
        public boolean isLeaf() {
            return true;
        }

        @Override
        public E root() {
            throw new StructuralTypeException("root on leaf");
        }

        @Override
        public PersistentTree<E> left() {
            throw new StructuralTypeException("left on leaf");
        }

        @Override
        public PersistentTree<E> right() {
            throw new StructuralTypeException("right on leaf");
        }

        @Override
        public int size() {
            return 0;
        }
    }

    public static final class Node<E> extends PersistentTree<E> {
        private final PersistentTree<E> left;
        private final E value;
        private final PersistentTree<E> right;
        // children are immutable, so the recursive count can be taken once
        private final int size;

        private Node(PersistentTree<E> left, E value, PersistentTree<E> right) {
            this.left = left;
            this.value = value;
            this.right = right;
            this.size = 1 + left.size() + right.size();
        }

        @Override
        public boolean isLeaf() {
            return false;
        }

        @Override
        public E root() {
            return value;
        }

        @Override
        public PersistentTree<E> left() {
            return left;
        }

        @Override
        public PersistentTree<E> right() {
            return right;
        }

        @Override
        public int size() {
            return size;
        }
    }
}
