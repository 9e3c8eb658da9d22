package dev.evalset.eval;

import java.util.List;
import java.util.Optional;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Datasets define the samples a task is evaluated on. This interface provides a means of
 * iterating through all samples of a particular dataset.
 */
public interface Dataset<INPUT, OUTPUT> {
    Cursor<DatasetCase<INPUT, OUTPUT>> openCursor();

    String id();

    @NotThreadSafe
    interface Cursor<CASE> extends AutoCloseable {
        /**
         * Fetch the next case. Returns empty if there are no more cases to fetch.
         *
         * <p>If this method is invoked after {@link #close()} an IllegalStateException will be
         * thrown
         */
        Optional<CASE> next();

        /** close all cursor resources */
        @Override
        void close();
    }

    /** Create an in-memory Dataset containing the provided cases. */
    @SafeVarargs
    static <INPUT, OUTPUT> Dataset<INPUT, OUTPUT> of(DatasetCase<INPUT, OUTPUT>... cases) {
        return new DatasetInMemoryImpl<>(List.of(cases));
    }

    static <INPUT, OUTPUT> Dataset<INPUT, OUTPUT> of(List<DatasetCase<INPUT, OUTPUT>> cases) {
        return new DatasetInMemoryImpl<>(cases);
    }
}
