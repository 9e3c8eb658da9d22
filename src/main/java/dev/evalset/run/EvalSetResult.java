package dev.evalset.run;

import dev.evalset.log.EvalLog;
import dev.evalset.log.EvalStatus;
import java.util.List;

/**
 * Outcome of an eval set run.
 *
 * @param success true iff every resolved task has a successful log
 * @param logs one log per resolved task, in submission order, with samples loaded
 */
public record EvalSetResult(boolean success, List<EvalLog> logs) {
    public EvalSetResult {
        logs = List.copyOf(logs);
    }

    public long countWithStatus(EvalStatus status) {
        return logs.stream().filter(log -> log.status() == status).count();
    }

    public String createReportString() {
        return "Eval set %s: %d of %d task(s) succeeded"
                .formatted(
                        success ? "complete" : "incomplete",
                        countWithStatus(EvalStatus.SUCCESS),
                        logs.size());
    }
}
