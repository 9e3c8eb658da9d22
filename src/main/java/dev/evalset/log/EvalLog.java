package dev.evalset.log;

import java.util.List;
import javax.annotation.Nonnull;

/**
 * A persisted task execution.
 *
 * <p>Logs produced by index scans carry only the header; their sample list is empty. Use {@link
 * LogIndex#readLog(String)} to load the samples.
 *
 * @param location where the log is stored, as understood by the {@link LogStore} that listed it
 */
public record EvalLog(
        @Nonnull String location,
        @Nonnull EvalLogHeader header,
        @Nonnull List<SampleOutcome> samples) {

    public EvalLog {
        samples = List.copyOf(samples);
    }

    public EvalStatus status() {
        return header.status();
    }

    public EvalLogKey key() {
        return header.key();
    }
}
