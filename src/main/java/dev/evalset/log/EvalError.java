package dev.evalset.log;

import java.io.PrintWriter;
import java.io.StringWriter;
import javax.annotation.Nonnull;

/** A failure captured in a log, either for a single sample or for the whole task. */
public record EvalError(@Nonnull String message, @Nonnull String type, @Nonnull String traceback) {

    public static EvalError from(Throwable t) {
        var trace = new StringWriter();
        t.printStackTrace(new PrintWriter(trace));
        var message = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        return new EvalError(message, t.getClass().getName(), trace.toString());
    }

    public static EvalError of(String message, String type) {
        return new EvalError(message, type, "");
    }
}
