package io.surfworks.warpgrad.core.graph;

final class RecorderHolder {

    static final ThreadLocal<CallRecorder> CURRENT = new ThreadLocal<>();

    private RecorderHolder() {
    }
}
