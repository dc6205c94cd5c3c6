package io.github.gittask.exception;

import io.github.gittask.remote.TrackerKind;

/** A remote tracker call failed: network, authentication, rate limiting, timeout or an unexpected HTTP status. */
public class RemoteFailureException extends GitTaskException {
    public enum Reason {
        NETWORK,
        AUTH,
        RATE_LIMIT,
        TIMEOUT,
        HTTP
    }

    private final TrackerKind trackerKind;
    private final Reason reason;
    private final boolean retryable;

    public RemoteFailureException(TrackerKind trackerKind, Reason reason, boolean retryable, String message) {
        super(ErrorKind.REMOTE_FAILURE, message);
        this.trackerKind = trackerKind;
        this.reason = reason;
        this.retryable = retryable;
    }

    public RemoteFailureException(
            TrackerKind trackerKind, Reason reason, boolean retryable, String message, Throwable cause) {
        super(ErrorKind.REMOTE_FAILURE, message, cause);
        this.trackerKind = trackerKind;
        this.reason = reason;
        this.retryable = retryable;
    }

    public TrackerKind trackerKind() {
        return trackerKind;
    }

    public Reason reason() {
        return reason;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Carries a remote failure out of a lazy {@link java.util.Iterator}, whose methods cannot throw checked
     * exceptions.
     */
    public static class Unchecked extends RuntimeException {
        public Unchecked(RemoteFailureException cause) {
            super(cause.getMessage(), cause);
        }

        @Override
        public synchronized RemoteFailureException getCause() {
            return (RemoteFailureException) super.getCause();
        }
    }
}
