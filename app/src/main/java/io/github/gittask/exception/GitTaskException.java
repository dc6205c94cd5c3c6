package io.github.gittask.exception;

/**
 * Base of every failure the task store and the sync engine report. The {@link ErrorKind} decides how a caller
 * reacts: local kinds abort a command, remote kinds are isolated per item.
 */
public abstract class GitTaskException extends Exception {
    private final ErrorKind kind;

    protected GitTaskException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GitTaskException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
