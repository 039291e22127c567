package com.unnc.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Index-addressed scope frames. Each invocation pushes a frame whose parent is the caller's
 * frame; lookups walk the parent chain, writes always land in the frame they were issued in.
 * Frames are released in LIFO order.
 */
public final class ScopeArena {

    public static final int NO_FRAME = -1;

    private static final class Frame {
        final int parent;
        final Map<String, Value> bindings = new LinkedHashMap<>();

        Frame(int parent) {
            this.parent = parent;
        }
    }

    private final List<Frame> frames = new ArrayList<>();

    /** Pushes an empty frame whose lookups fall through to {@code parent}. */
    public int push(int parent) {
        if (parent != NO_FRAME) check(parent);
        frames.add(new Frame(parent));
        return frames.size() - 1;
    }

    /** Drops {@code frame} and everything pushed after it. */
    public void release(int frame) {
        check(frame);
        frames.subList(frame, frames.size()).clear();
    }

    /** Nearest binding of {@code name} walking up from {@code frame}; null when unbound. */
    public Value lookup(int frame, String name) {
        int at = frame;
        while (at != NO_FRAME) {
            Frame f = frames.get(at);
            Value v = f.bindings.get(name);
            if (v != null) return v;
            at = f.parent;
        }
        return null;
    }

    public void bind(int frame, String name, Value value) {
        check(frame);
        frames.get(frame).bindings.put(name, value);
    }

    public int depth() {
        return frames.size();
    }

    private void check(int frame) {
        if (frame < 0 || frame >= frames.size()) {
            throw new IllegalStateException("No live scope frame " + frame + " (depth " + frames.size() + ")");
        }
    }
}
