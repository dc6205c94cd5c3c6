package io.github.gittask.exception;

public class EncodingException extends GitTaskException {
    public EncodingException(String message) {
        super(ErrorKind.ENCODING, message);
    }

    public EncodingException(String message, Throwable cause) {
        super(ErrorKind.ENCODING, message, cause);
    }
}
