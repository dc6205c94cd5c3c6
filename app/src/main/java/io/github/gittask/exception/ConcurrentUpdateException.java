package io.github.gittask.exception;

/** The task ref moved between reading a snapshot and writing the new commit. */
public class ConcurrentUpdateException extends GitTaskException {
    public ConcurrentUpdateException(String message) {
        super(ErrorKind.CONCURRENT_MODIFICATION, message);
    }
}
