import com.unnc.debug.DebugLevel;
import com.unnc.debug.DebugSink;

import java.util.ArrayList;
import java.util.List;

/** Test sink recording every message it receives. */
public class CapturingDebugSink implements DebugSink {

    public static final class Entry {
        public final DebugLevel level;
        public final String tag;
        public final String message;
        public final Throwable error;

        Entry(DebugLevel level, String tag, String message, Throwable error) {
            this.level = level;
            this.tag = tag;
            this.message = message;
            this.error = error;
        }

        @Override
        public String toString() {
            return "[" + level + "] " + tag + ": " + message;
        }
    }

    public final List<Entry> entries = new ArrayList<>();

    @Override
    public synchronized void log(DebugLevel level, String tag, String message, Throwable error) {
        entries.add(new Entry(level, tag, message, error));
    }

    public List<Entry> at(DebugLevel level) {
        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) if (e.level == level) out.add(e);
        return out;
    }

    public boolean contains(DebugLevel level, String fragment) {
        for (Entry e : entries) {
            if (e.level == level && e.message.contains(fragment)) return true;
        }
        return false;
    }
}
