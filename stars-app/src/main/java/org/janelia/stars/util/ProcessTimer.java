package org.janelia.stars.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tracks overall elapsed time along with named laps for the stages of a process.
 * Instances are not thread safe, laps should be recorded by the thread that owns the timer.
 */
public class ProcessTimer {

    private final long start;
    private long lapStart;
    private final Map<String, Long> lapMilliseconds;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
        this.lapStart = this.start;
        this.lapMilliseconds = new LinkedHashMap<>();
    }

    /**
     * Ends the current lap, records it with the specified name, and starts the next lap.
     *
     * @return milliseconds spent in the finished lap.
     */
    public long lap(final String name) {
        final long now = System.currentTimeMillis();
        final long elapsed = now - lapStart;
        lapMilliseconds.merge(name, elapsed, Long::sum);
        lapStart = now;
        return elapsed;
    }

    /**
     * @return recorded lap times in the order the laps were first recorded.
     */
    public Map<String, Long> getLapMilliseconds() {
        return new LinkedHashMap<>(lapMilliseconds);
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        final long totalMilliseconds = getElapsedMilliseconds();
        if (totalMilliseconds < 60000) {
            sb.append(totalMilliseconds).append(" ms");
        } else {
            final long totalSeconds = totalMilliseconds / 1000;
            sb.append(totalSeconds / 3600).append(" hours, ");
            sb.append((totalSeconds / 60) % 60).append(" minutes, ");
            sb.append(totalSeconds % 60).append(" seconds");
        }
        if (! lapMilliseconds.isEmpty()) {
            sb.append(" ").append(lapMilliseconds);
        }
        return sb.toString();
    }
}
