package dev.evalset.run;

import javax.annotation.Nullable;

/**
 * Thrown by a run that was cancelled or whose thread was interrupted. Raised only after every task
 * already dispatched has finished or abandoned, so all logs reflect the last state reached. Running
 * the same eval set again resumes from those logs.
 */
public class EvalSetInterruptedException extends RuntimeException {
    public EvalSetInterruptedException(String message) {
        super(message);
    }

    public EvalSetInterruptedException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
