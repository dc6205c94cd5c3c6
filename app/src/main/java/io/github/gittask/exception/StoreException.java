package io.github.gittask.exception;

import java.io.IOException;

/**
 * I/O failure of the underlying git object database. Reported with the encoding kind because, like a malformed
 * record, it leaves the stored data unreadable for this command.
 */
public class StoreException extends GitTaskException {
    public StoreException(String message, IOException cause) {
        super(ErrorKind.ENCODING, message, cause);
    }
}
