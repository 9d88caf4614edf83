package com.phillippitts.serverwarden.service.schedule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableSet;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Fires a warning once at each of several remaining-time thresholds before an action executes.
 *
 * <p>A threshold of {@code t} minutes is due when {@code remaining <= t} and
 * {@code remaining > t - 2} minutes. The window lets a slow tick still hit it; the sent-set keeps
 * a fast tick from firing it twice. A threshold whose window has passed unnoticed is not fired late.
 *
 * <p>Shared by admin-scheduled actions (thresholds chosen from the original delay) and periodic
 * restarts (fixed 15/5/1 minutes).
 */
public final class TieredWarningTimer {

    /** Width of the window in which a threshold may still fire. */
    static final Duration FIRE_WINDOW = Duration.ofMinutes(2);

    private static final Duration LONG_DELAY = Duration.ofMinutes(14);
    private static final Duration MEDIUM_DELAY = Duration.ofMinutes(5);

    private final List<Integer> thresholds;
    private final NavigableSet<Integer> sent = new ConcurrentSkipListSet<>(Comparator.reverseOrder());

    private TieredWarningTimer(List<Integer> thresholds) {
        List<Integer> sorted = new ArrayList<>(thresholds);
        sorted.sort(Comparator.reverseOrder());
        this.thresholds = Collections.unmodifiableList(sorted);
    }

    /**
     * Timer for an action whose original requested delay was {@code originalDelay}.
     * <ul>
     *   <li>more than 14 minutes: 10, 5 and 1 minutes</li>
     *   <li>more than 5 minutes: 5 and 1 minutes</li>
     *   <li>otherwise: 1 minute only</li>
     * </ul>
     */
    public static TieredWarningTimer forOriginalDelay(Duration originalDelay) {
        if (originalDelay.compareTo(LONG_DELAY) > 0) {
            return new TieredWarningTimer(List.of(10, 5, 1));
        }
        if (originalDelay.compareTo(MEDIUM_DELAY) > 0) {
            return new TieredWarningTimer(List.of(5, 1));
        }
        return new TieredWarningTimer(List.of(1));
    }

    /**
     * Timer with a fixed set of thresholds, in minutes.
     */
    public static TieredWarningTimer fixed(int... minutes) {
        List<Integer> values = new ArrayList<>();
        for (int m : minutes) {
            if (m <= 0) {
                throw new IllegalArgumentException("Warning thresholds must be positive, got: " + m);
            }
            values.add(m);
        }
        return new TieredWarningTimer(values);
    }

    /**
     * Returns the thresholds that fire now, largest first, and records them as sent.
     *
     * @param remaining time left until the action executes
     */
    public List<Integer> due(Duration remaining) {
        List<Integer> firing = new ArrayList<>(1);
        for (Integer threshold : thresholds) {
            if (sent.contains(threshold)) {
                continue;
            }
            Duration upper = Duration.ofMinutes(threshold);
            Duration lower = upper.minus(FIRE_WINDOW);
            if (remaining.compareTo(upper) <= 0 && remaining.compareTo(lower) > 0) {
                sent.add(threshold);
                firing.add(threshold);
            }
        }
        return firing;
    }

    /** Configured thresholds, largest first. */
    public List<Integer> thresholds() {
        return thresholds;
    }

    /** Thresholds already fired, largest first. */
    public Set<Integer> sent() {
        return Collections.unmodifiableSet(sent);
    }

    /** Forgets every fired threshold. */
    public void reset() {
        sent.clear();
    }
}
