package dev.evalset.run;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Cooperative cancellation signal for an eval set run. Cancelling is idempotent and checking never
 * blocks. The coordinator stops dispatching once cancelled and running tasks stop at their next
 * sample boundary.
 */
@ThreadSafe
public final class CancellationToken {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleep for the given duration unless cancelled first.
     *
     * @return true if the full duration elapsed, false if the token was cancelled
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return !isCancelled();
        }
        return !cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }
}
