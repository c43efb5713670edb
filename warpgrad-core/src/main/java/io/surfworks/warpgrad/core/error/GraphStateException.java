package io.surfworks.warpgrad.core.error;

/**
 * Graph discipline violation: nesting static regions, replaying a schedule
 * before it was built, back-propagating through a released node, or applying
 * one operation node instance twice.
 */
public class GraphStateException extends IllegalStateException {

    public GraphStateException(String message) {
        super(message);
    }

    public GraphStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
