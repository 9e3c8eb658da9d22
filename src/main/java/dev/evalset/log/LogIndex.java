package dev.evalset.log;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Indexes the logs under a {@link LogStore} by {@link EvalLogKey} and decides which of them is
 * authoritative.
 *
 * <p>The authoritative log for a key is its most recent completed log. Logs still in {@link
 * EvalStatus#STARTED} never count, and logs that cannot be parsed are skipped rather than treated
 * as failures, so the worst a corrupt or half written file can cause is a re-run.
 */
@Slf4j
public final class LogIndex {
    /** latest timestamp wins, then the higher attempt, then the greater location */
    static final Comparator<EvalLog> RECENCY =
            Comparator.<EvalLog, Instant>comparing(l -> l.header().timestamp())
                    .thenComparingInt(l -> l.header().attempt())
                    .thenComparing(EvalLog::location);

    private final LogStore store;

    public LogIndex(LogStore store) {
        this.store = Objects.requireNonNull(store);
    }

    public LogStore store() {
        return store;
    }

    /**
     * Header-only scan of every log under the store.
     *
     * @throws LogStoreException if the store cannot be listed
     */
    public List<EvalLog> listAllLogs() {
        var logs = new ArrayList<EvalLog>();
        for (var location : store.list()) {
            readHeader(location)
                    .ifPresent(header -> logs.add(new EvalLog(location, header, List.of())));
        }
        return logs;
    }

    private Optional<EvalLogHeader> readHeader(String location) {
        try (var in = store.open(location)) {
            return Optional.of(EvalLogCodec.decodeHeader(in));
        } catch (IOException | RuntimeException e) {
            log.warn("skipping unreadable log {}: {}", location, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Read a log including its samples.
     *
     * @throws LogStoreException if the log cannot be read or parsed
     */
    public EvalLog readLog(String location) {
        try (var in = store.open(location)) {
            return EvalLogCodec.decode(location, in);
        } catch (IOException e) {
            throw new LogStoreException("failed to read log " + location, e);
        }
    }

    /**
     * Select the authoritative log per key: the most recent log which is not {@link
     * EvalStatus#STARTED}. Keys with no completed log are absent from the result.
     *
     * @param cleanupOlder when set, every other log of a key that has an authoritative log is
     *     deleted from the store, including stale started logs
     */
    public Map<EvalLogKey, EvalLog> latestCompleted(List<EvalLog> logs, boolean cleanupOlder) {
        var byKey = groupByKey(logs);
        var latest = new LinkedHashMap<EvalLogKey, EvalLog>();
        byKey.forEach(
                (key, keyLogs) ->
                        keyLogs.stream()
                                .filter(l -> l.status().isCompleted())
                                .max(RECENCY)
                                .ifPresent(l -> latest.put(key, l)));
        if (cleanupOlder) {
            latest.forEach(
                    (key, selected) -> {
                        for (var superseded : byKey.get(key)) {
                            if (!superseded.location().equals(selected.location())) {
                                deleteQuietly(superseded);
                            }
                        }
                    });
        }
        return latest;
    }

    /** Most recent log of any status per key, for keys that have never completed. */
    public static Map<EvalLogKey, EvalLog> latestAny(List<EvalLog> logs) {
        var latest = new LinkedHashMap<EvalLogKey, EvalLog>();
        groupByKey(logs)
                .forEach(
                        (key, keyLogs) ->
                                keyLogs.stream().max(RECENCY).ifPresent(l -> latest.put(key, l)));
        return latest;
    }

    /** The previous authoritative log for a key, if any. */
    public static Optional<EvalLog> matchPrevious(
            EvalLogKey key, Map<EvalLogKey, EvalLog> authoritative) {
        return Optional.ofNullable(authoritative.get(key));
    }

    private static Map<EvalLogKey, List<EvalLog>> groupByKey(List<EvalLog> logs) {
        var byKey = new LinkedHashMap<EvalLogKey, List<EvalLog>>();
        for (var evalLog : logs) {
            byKey.computeIfAbsent(evalLog.key(), k -> new ArrayList<>()).add(evalLog);
        }
        return byKey;
    }

    private void deleteQuietly(EvalLog superseded) {
        try {
            store.delete(superseded.location());
            log.debug("removed superseded log {}", superseded.location());
        } catch (LogStoreException e) {
            // a leftover log is re-examined on the next scan
            log.warn("failed to remove superseded log {}", superseded.location(), e);
        }
    }
}
