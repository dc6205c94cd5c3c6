package io.github.gittask.exception;

import io.github.gittask.remote.TrackerKind;

public class UnsupportedRemoteOperationException extends GitTaskException {
    private final TrackerKind trackerKind;

    public UnsupportedRemoteOperationException(TrackerKind trackerKind, String operation) {
        super(ErrorKind.UNSUPPORTED_OPERATION, trackerKind.getDisplayName() + " does not support " + operation);
        this.trackerKind = trackerKind;
    }

    public TrackerKind trackerKind() {
        return trackerKind;
    }
}
