package io.surfworks.warpgrad.core.schedule;

import io.surfworks.warpgrad.core.error.GraphStateException;
import io.surfworks.warpgrad.core.graph.CallRecorder;

/**
 * Thread-local marker of the schedule currently being traced. While open,
 * every applied operation is recorded into that schedule.
 *
 * <p>Static regions cannot be nested: opening a context while another one is
 * active on the same thread fails.
 */
public final class ScheduleContext implements AutoCloseable {

    private static final ThreadLocal<StaticSchedule> ACTIVE = new ThreadLocal<>();

    private final CallRecorder.Installation recording;
    private boolean closed;

    private ScheduleContext(StaticSchedule schedule) {
        ACTIVE.set(schedule);
        this.recording = CallRecorder.install(schedule::record);
    }

    /**
     * @throws GraphStateException if a static region is already being traced
     */
    public static ScheduleContext enter(StaticSchedule schedule) {
        if (ACTIVE.get() != null) {
            throw new GraphStateException("Not allowed to nest static regions");
        }
        return new ScheduleContext(schedule);
    }

    /**
     * The schedule being traced on this thread, or null.
     */
    public static StaticSchedule current() {
        return ACTIVE.get();
    }

    public static boolean isActive() {
        return ACTIVE.get() != null;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            recording.close();
            ACTIVE.remove();
        }
    }
}
