package io.github.gittask.testutil;

import io.github.gittask.config.TaskConfig;
import io.github.gittask.repository.TaskRepository;
import io.github.gittask.store.GitObjectStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;

/** A freshly initialized repository under a JUnit temp directory, with a store and task repository on top. */
public final class TempGitRepo implements AutoCloseable {
    private final Git git;
    private final GitObjectStore store;

    private TempGitRepo(Git git) {
        this.git = git;
        this.store = new GitObjectStore(git.getRepository());
    }

    public static TempGitRepo init(Path dir) throws GitAPIException, IOException {
        var git = Git.init().setDirectory(dir.toFile()).setInitialBranch("main").call();
        var config = git.getRepository().getConfig();
        config.setString("user", null, "name", "Test User");
        config.setString("user", null, "email", "test@example.com");
        config.save();
        return new TempGitRepo(git);
    }

    public Git git() {
        return git;
    }

    public GitObjectStore store() {
        return store;
    }

    public TaskConfig config() {
        return TaskConfig.of(Map.of());
    }

    public TaskRepository repository() {
        return new TaskRepository(store, config());
    }

    @Override
    public void close() {
        git.close();
    }
}
