package io.github.gittask.sync;

/**
 * @param createMissing create remote issues for tasks that are not linked yet
 * @param parallelism number of tasks pushed concurrently
 */
public record PushOptions(boolean createMissing, boolean includeComments, boolean includeLabels, int parallelism) {
    public static final int DEFAULT_PARALLELISM = 4;

    public PushOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
    }

    public static PushOptions defaults() {
        return new PushOptions(true, true, true, DEFAULT_PARALLELISM);
    }
}
