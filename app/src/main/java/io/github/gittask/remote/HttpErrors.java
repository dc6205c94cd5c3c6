package io.github.gittask.remote;

import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.RemoteFailureException.Reason;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;

/** Maps HTTP statuses and transport failures of tracker calls onto the error kinds the sync engine reports. */
public final class HttpErrors {
    private HttpErrors() {}

    /**
     * @param what the resource, e.g. {@code issue 42}, used in messages
     */
    public static GitTaskException fromStatus(TrackerKind kind, int code, String what, String detail) {
        String message = kind.getDisplayName() + " returned " + code + " for " + what + (detail.isBlank() ? "" : ": " + detail);
        if (code == 404) {
            return new NotFoundException(kind.getDisplayName() + " " + what + " not found");
        }
        if (code == 401 || code == 403) {
            return new RemoteFailureException(kind, Reason.AUTH, false, message);
        }
        if (code == 429) {
            return new RemoteFailureException(kind, Reason.RATE_LIMIT, true, message);
        }
        return new RemoteFailureException(kind, Reason.HTTP, code >= 500, message);
    }

    public static RemoteFailureException fromIOException(TrackerKind kind, IOException e, String what) {
        if (e instanceof SocketTimeoutException || (e instanceof InterruptedIOException && "timeout".equals(e.getMessage()))) {
            return new RemoteFailureException(kind, Reason.TIMEOUT, true,
                    kind.getDisplayName() + " timed out on " + what, e);
        }
        return new RemoteFailureException(kind, Reason.NETWORK, true,
                kind.getDisplayName() + " request for " + what + " failed: " + e.getMessage(), e);
    }

    /**
     * Maps exceptions of client libraries that report HTTP errors as {@link IOException}s carrying the status.
     */
    public static GitTaskException fromIOException(TrackerKind kind, IOException e, String what, int responseCode) {
        if (e instanceof FileNotFoundException || responseCode == 404) {
            return new NotFoundException(kind.getDisplayName() + " " + what + " not found");
        }
        if (responseCode > 0) {
            return fromStatus(kind, responseCode, what, e.getMessage() == null ? "" : e.getMessage());
        }
        return fromIOException(kind, e, what);
    }

    /** Listing iterators can only carry remote failures, so a vanished resource becomes a non-retryable one. */
    public static RemoteFailureException forListing(TrackerKind kind, GitTaskException e) {
        if (e instanceof RemoteFailureException remote) {
            return remote;
        }
        return new RemoteFailureException(kind, Reason.HTTP, false, e.getMessage(), e);
    }
}
