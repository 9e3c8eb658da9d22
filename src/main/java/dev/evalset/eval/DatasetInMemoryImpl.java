package dev.evalset.eval;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/** Samples held in a list. Every cursor replays the list from its first sample. */
class DatasetInMemoryImpl<INPUT, OUTPUT> implements Dataset<INPUT, OUTPUT> {
    private final List<DatasetCase<INPUT, OUTPUT>> samples;

    DatasetInMemoryImpl(List<DatasetCase<INPUT, OUTPUT>> samples) {
        this.samples = List.copyOf(samples);
    }

    /** {@code memory:<sample count>}, e.g. {@code memory:3} */
    @Override
    public String id() {
        return "memory:" + samples.size();
    }

    @Override
    public Cursor<DatasetCase<INPUT, OUTPUT>> openCursor() {
        return new SampleCursor<>(samples.iterator());
    }

    private static final class SampleCursor<CASE> implements Cursor<CASE> {
        private Iterator<CASE> remaining;

        SampleCursor(Iterator<CASE> remaining) {
            this.remaining = remaining;
        }

        @Override
        public Optional<CASE> next() {
            if (remaining == null) {
                throw new IllegalStateException("cursor is closed");
            }
            return remaining.hasNext() ? Optional.of(remaining.next()) : Optional.empty();
        }

        @Override
        public void close() {
            remaining = null;
        }
    }
}
