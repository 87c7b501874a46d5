package org.calista.kinda.loop;

import org.calista.kinda.events.ChaosReporter;
import org.calista.kinda.events.EventType;

import java.util.Objects;

/**
 * eventually_until: keeps looping until the Wilson lower bound on the condition's success rate
 * (over the most recent window) exceeds the threshold fixed when the loop began.
 *
 * <p>Two degenerate cases use the plain proportion instead: a non-finite bound, and a full window
 * whose best possible bound still cannot pass the threshold. Both are reported once per loop.
 * The evaluation cap ends the loop with a timeout event.</p>
 */
public final class ConfidenceLoop {

    public enum Outcome { RUNNING, CONFIDENT, TIMED_OUT }

    private final double threshold;
    private final LoopSettings settings;
    private final ChaosReporter reporter;
    private final ConfidenceBuffer buffer;
    private final boolean unreachable;

    private Outcome outcome = Outcome.RUNNING;
    private int evaluations;
    private double lastLowerBound = Double.NaN;
    private boolean fallbackReported;

    public ConfidenceLoop(double threshold, LoopSettings settings, ChaosReporter reporter) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) throw new IllegalArgumentException("threshold must be in [0,1]: " + threshold);
        this.threshold = threshold;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.buffer = new ConfidenceBuffer(settings.bufferSize);

        double best = WilsonScore.lowerBound(settings.bufferSize, settings.bufferSize, settings.confidenceZ);
        this.unreachable = !(best > threshold);
    }

    /**
     * Records one evaluation of the condition.
     *
     * @return true while the loop should keep running
     */
    public boolean step(boolean condition) {
        if (outcome != Outcome.RUNNING) return false;

        evaluations++;
        buffer.add(condition);

        if (buffer.size() >= settings.minSamples && confident()) {
            outcome = Outcome.CONFIDENT;
            return false;
        }
        if (evaluations >= settings.maxEvaluations) {
            outcome = Outcome.TIMED_OUT;
            reporter.report(EventType.CONFIDENCE_TIMEOUT, "eventually_until",
                    "no confidence after " + evaluations + " evaluations (rate=" + buffer.proportion()
                            + ", threshold=" + threshold + ")");
            return false;
        }
        return true;
    }

    private boolean confident() {
        double lb = WilsonScore.lowerBound(buffer.trues(), buffer.size(), settings.confidenceZ);
        lastLowerBound = lb;
        if (Double.isFinite(lb) && !unreachable) {
            return lb > threshold;
        }
        if (!Double.isFinite(lb) || buffer.isFull()) {
            reportFallback(Double.isFinite(lb) ? "threshold above best bound for window " + buffer.capacity() : "bound not finite");
            return buffer.proportion() >= threshold;
        }
        // unreachable threshold, window still filling
        return false;
    }

    private void reportFallback(String why) {
        if (fallbackReported) return;
        fallbackReported = true;
        reporter.report(EventType.CONFIDENCE_FALLBACK, "eventually_until", why + "; using proportion check");
    }

    public Outcome outcome() {
        return outcome;
    }

    public int evaluations() {
        return evaluations;
    }

    public double threshold() {
        return threshold;
    }

    public double lastLowerBound() {
        return lastLowerBound;
    }

    public ConfidenceBuffer buffer() {
        return buffer;
    }
}
