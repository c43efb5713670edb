package io.surfworks.warpgrad.core.graph;

import io.surfworks.warpgrad.core.array.NdArray;

import java.util.List;
import java.util.Objects;

/**
 * Observer of every operation applied on the current thread.
 *
 * <p>At most one recorder is installed per thread. The schedule compiler
 * installs one while it traces a static region.
 */
public interface CallRecorder {

    /**
     * Called by {@link GraphBuilder} after the forward computation of
     * {@code node} has produced {@code outputs} from {@code inputs}.
     */
    void record(OperationNode node, List<NdArray> inputs, List<NdArray> outputs);

    /**
     * The recorder installed on this thread, or null.
     */
    static CallRecorder current() {
        return RecorderHolder.CURRENT.get();
    }

    /**
     * Installs {@code recorder} until the returned handle is closed.
     */
    static Installation install(CallRecorder recorder) {
        Objects.requireNonNull(recorder, "recorder cannot be null");
        return new Installation(recorder);
    }

    /**
     * Scope of an installed recorder. Closing restores the previous one.
     */
    final class Installation implements AutoCloseable {

        private final CallRecorder previous;
        private boolean closed;

        private Installation(CallRecorder recorder) {
            this.previous = RecorderHolder.CURRENT.get();
            RecorderHolder.CURRENT.set(recorder);
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                if (previous == null) {
                    RecorderHolder.CURRENT.remove();
                } else {
                    RecorderHolder.CURRENT.set(previous);
                }
            }
        }
    }
}
