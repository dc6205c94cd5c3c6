package io.github.gittask.exception;

public class NotFoundException extends GitTaskException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException task(long id) {
        return new NotFoundException("Task ID " + id + " not found");
    }

    public static NotFoundException comment(long taskId, long commentId) {
        return new NotFoundException("Comment ID " + commentId + " not found in task ID " + taskId);
    }
}
