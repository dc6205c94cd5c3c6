package io.github.gittask.remote;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.RemoteFailureException.Reason;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;

public class HttpErrorsTest {

    @Test
    void testStatusMapping() {
        assertInstanceOf(NotFoundException.class, HttpErrors.fromStatus(TrackerKind.JIRA, 404, "issue PROJ-1", ""));

        var forbidden = (RemoteFailureException) HttpErrors.fromStatus(TrackerKind.JIRA, 403, "issue PROJ-1", "no access");
        assertEquals(Reason.AUTH, forbidden.reason());
        assertEquals("Jira returned 403 for issue PROJ-1: no access", forbidden.getMessage());

        var badRequest = (RemoteFailureException) HttpErrors.fromStatus(TrackerKind.JIRA, 400, "issue PROJ-1", "");
        assertEquals(Reason.HTTP, badRequest.reason());
        assertFalse(badRequest.isRetryable(), "Client errors are not retried");

        var unavailable = (RemoteFailureException) HttpErrors.fromStatus(TrackerKind.JIRA, 502, "issue PROJ-1", "");
        assertTrue(unavailable.isRetryable());
    }

    @Test
    void testTransportFailures() {
        var timeout = HttpErrors.fromIOException(TrackerKind.REDMINE, new SocketTimeoutException("read"), "issue 4");
        assertEquals(Reason.TIMEOUT, timeout.reason());
        assertTrue(timeout.isRetryable());

        var reset = HttpErrors.fromIOException(TrackerKind.REDMINE, new IOException("connection reset"), "issue 4");
        assertEquals(Reason.NETWORK, reset.reason());
        assertTrue(reset.getMessage().contains("connection reset"), reset.getMessage());
    }

    @Test
    void testLibraryExceptionsWithStatus() {
        assertInstanceOf(NotFoundException.class,
                HttpErrors.fromIOException(TrackerKind.GITHUB, new FileNotFoundException("x"), "issue 1", -1));
        var auth = (RemoteFailureException) HttpErrors.fromIOException(TrackerKind.GITHUB, new IOException("Bad credentials"), "issue 1", 401);
        assertEquals(Reason.AUTH, auth.reason());
        var plain = (RemoteFailureException) HttpErrors.fromIOException(TrackerKind.GITHUB, new IOException("reset"), "issue 1", -1);
        assertEquals(Reason.NETWORK, plain.reason());
    }

    @Test
    void testListingWrapsVanishedResources() {
        var wrapped = HttpErrors.forListing(TrackerKind.GITLAB, new NotFoundException("GitLab project not found"));
        assertEquals(Reason.HTTP, wrapped.reason());
        assertFalse(wrapped.isRetryable());
        assertInstanceOf(NotFoundException.class, wrapped.getCause());
    }

    @Test
    void testLabelColors() {
        assertEquals("d73a4a", LabelColors.toHex("Red"));
        assertEquals("c5def5", LabelColors.toHex("light_cyan"));
        assertEquals("abcdef", LabelColors.toHex("#ABCDEF"));
        assertEquals(LabelColors.DEFAULT_HEX, LabelColors.toHex("chartreuse"));
    }
}
