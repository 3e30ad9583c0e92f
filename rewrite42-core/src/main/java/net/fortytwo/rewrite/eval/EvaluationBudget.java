package net.fortytwo.rewrite.eval;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A cooperative cancellation budget: a maximum number of evaluation steps and an optional deadline.
 * Path node expansions and EXISTS evaluations each consume one step.
 * A budget may be shared by several threads evaluating parts of the same query.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class EvaluationBudget {
    public static final long UNLIMITED = -1;

    private final long maxSteps;
    private final long deadline;
    private final AtomicLong steps = new AtomicLong(0);

    /**
     * @param maxSteps      the maximum number of steps, or {@link #UNLIMITED}
     * @param timeoutMillis the time allowed for evaluation, in milliseconds, or {@link #UNLIMITED}
     */
    public EvaluationBudget(final long maxSteps, final long timeoutMillis) {
        this.maxSteps = maxSteps;
        this.deadline = timeoutMillis < 0
                ? 0
                : System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
    }

    public static EvaluationBudget unlimited() {
        return new EvaluationBudget(UNLIMITED, UNLIMITED);
    }

    /**
     * Consumes one step of this budget
     *
     * @throws ResourceExceededException if the step limit or the deadline has been exceeded
     */
    public void step() {
        long n = steps.incrementAndGet();
        if (maxSteps >= 0 && n > maxSteps) {
            throw new ResourceExceededException("evaluation exceeded " + maxSteps + " steps");
        }
        if (0 != deadline && System.nanoTime() - deadline > 0) {
            throw new ResourceExceededException("evaluation timed out after " + n + " steps");
        }
    }

    public long getSteps() {
        return steps.get();
    }

    public long getMaxSteps() {
        return maxSteps;
    }
}
