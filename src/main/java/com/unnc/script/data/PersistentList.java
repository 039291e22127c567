package com.unnc.script.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import com.unnc.script.error.StructuralTypeException;

/**
 * Immutable singly-linked list: either {@link Empty} or {@link Cons}.
 *
 * cons shares the existing list as its tail; nothing is ever copied or mutated.
 */
public abstract class PersistentList<E> implements Iterable<E> {

    private static final Empty<?> EMPTY = new Empty<>();

    private PersistentList() {}

    @SuppressWarnings("unchecked")
    public static <E> PersistentList<E> empty() {
        return (PersistentList<E>) EMPTY;
    }

    /** Builds a list whose front-to-back order matches the collection's iteration order. */
    public static <E> PersistentList<E> of(Collection<? extends E> elements) {
        List<E> items = new ArrayList<>(elements);
        PersistentList<E> result = empty();
        for (int i = items.size() - 1; i >= 0; i--) {
            result = result.cons(items.get(i));
        }
        return result;
    }

    @SafeVarargs
    public static <E> PersistentList<E> of(E... elements) {
        PersistentList<E> result = empty();
        for (int i = elements.length - 1; i >= 0; i--) {
            result = result.cons(elements[i]);
        }
        return result;
    }

    public PersistentList<E> cons(E head) {
        return new Cons<>(head, this);
    }

    public abstract boolean isEmpty();

    /** Front element. Fails on {@link Empty}. */
    public abstract E value();

    /** Everything after the front element. Fails on {@link Empty}. */
    public abstract PersistentList<E> tail();

    public abstract int length();

    /**
     * Order-preserving concatenation: the elements of this list followed by {@code other}.
     * {@code other} is shared, not copied. Never sorts.
     */
    public PersistentList<E> merge(PersistentList<E> other) {
        if (isEmpty()) return other;
        if (other.isEmpty()) return this;

        List<E> prefix = toList();
        PersistentList<E> result = other;
        for (int i = prefix.size() - 1; i >= 0; i--) {
            result = result.cons(prefix.get(i));
        }
        return result;
    }

    public List<E> toList() {
        List<E> out = new ArrayList<>(length());
        for (E e : this) out.add(e);
        return out;
    }

    @Override
    public Iterator<E> iterator() {
        return new Iterator<E>() {
            private PersistentList<E> cur = PersistentList.this;

            @Override
            public boolean hasNext() {
                return !cur.isEmpty();
            }

            @Override
            public E next() {
                if (cur.isEmpty()) throw new NoSuchElementException();
                E v = cur.value();
                cur = cur.tail();
                return v;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistentList)) return false;
        PersistentList<?> a = this;
        PersistentList<?> b = (PersistentList<?>) o;
        if (a.length() != b.length()) return false;
        while (!a.isEmpty()) {
            if (!Objects.equals(a.value(), b.value())) return false;
            a = a.tail();
            b = b.tail();
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (E e : this) h = 31 * h + Objects.hashCode(e);
        return h;
    }

    @Override
    public String toString() {
        return isEmpty() ? "Nil" : toList().toString();
    }

    public static final class Empty<E> extends PersistentList<E> {
        private Empty() {}

        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public E value() {
            throw new StructuralTypeException("value on empty list");
        }

        @Override
        public PersistentList<E> tail() {
            throw new StructuralTypeException("tail on empty list");
        }

        @Override
        public int length() {
            return 0;
        }
    }

    public static final class Cons<E> extends PersistentList<E> {
        private final E head;
        private final PersistentList<E> tail;
        private final int length;

        private Cons(E head, PersistentList<E> tail) {
            this.head = head;
            this.tail = tail;
            this.length = tail.length() + 1;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public E value() {
            return head;
        }

        @Override
        public PersistentList<E> tail() {
            return tail;
        }

        @Override
        public int length() {
            return length;
        }
    }
}
