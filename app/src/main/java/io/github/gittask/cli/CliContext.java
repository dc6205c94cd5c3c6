package io.github.gittask.cli;

import com.google.common.base.Strings;
import io.github.gittask.config.ConfigStore;
import io.github.gittask.config.GitConfigStore;
import io.github.gittask.config.PropertyTable;
import io.github.gittask.config.StatusTable;
import io.github.gittask.config.TaskConfig;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.StoreException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.remote.RemoteTracker;
import io.github.gittask.remote.TrackerFactory;
import io.github.gittask.remote.TrackerKind;
import io.github.gittask.repository.TaskRepository;
import io.github.gittask.store.GitObjectStore;
import io.github.gittask.sync.TaskSynchronizer;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.lib.StoredConfig;
import org.jetbrains.annotations.Nullable;

/**
 * Everything a command needs from its surroundings: the repository found at or above the working directory, its
 * configuration, the environment and the standard streams. Resources are opened on first use.
 */
public class CliContext implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(CliContext.class);

    private static final String DEFAULT_EDITOR = "vi";

    /** Connects to the tracker chosen by {@code --connector} and {@code --remote}. */
    @FunctionalInterface
    public interface TrackerProvider {
        RemoteTracker connect(
                TaskConfig config, Map<String, String> remotes, @Nullable TrackerKind kind, @Nullable String remoteName)
                throws GitTaskException;
    }

    private final Path workDir;
    private final Function<String, @Nullable String> env;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final TrackerProvider trackerProvider;

    @Nullable
    private GitObjectStore store;

    public CliContext(Path workDir, Function<String, @Nullable String> env, InputStream in, PrintStream out,
            PrintStream err) {
        this(workDir, env, in, out, err,
                (config, remotes, kind, remoteName) -> new TrackerFactory(config, remotes).create(kind, remoteName));
    }

    public CliContext(Path workDir, Function<String, @Nullable String> env, InputStream in, PrintStream out,
            PrintStream err, TrackerProvider trackerProvider) {
        this.workDir = workDir;
        this.env = env;
        this.in = in;
        this.out = out;
        this.err = err;
        this.trackerProvider = trackerProvider;
    }

    public static CliContext system() {
        return new CliContext(Path.of("").toAbsolutePath(), System::getenv, System.in, System.out, System.err);
    }

    public PrintStream out() {
        return out;
    }

    public PrintStream err() {
        return err;
    }

    public @Nullable String env(String name) {
        return env.apply(name);
    }

    public ZoneId zone() {
        return ZoneId.systemDefault();
    }

    public synchronized GitObjectStore store() throws StoreException {
        if (store == null) {
            store = GitObjectStore.open(workDir);
        }
        return store;
    }

    private StoredConfig gitConfig() throws StoreException {
        return store().getRepository().getConfig();
    }

    public ConfigStore configStore() throws StoreException {
        return new GitConfigStore(gitConfig());
    }

    /** Read afresh on every call so that commands see their own config changes. */
    public TaskConfig config() throws StoreException {
        return TaskConfig.load(configStore(), env);
    }

    public StatusTable statuses() throws GitTaskException {
        return StatusTable.load(config());
    }

    public PropertyTable properties() throws GitTaskException {
        return PropertyTable.load(config());
    }

    public TaskRepository repository() throws StoreException {
        return new TaskRepository(store(), config());
    }

    public TaskSynchronizer synchronizer() throws GitTaskException {
        return new TaskSynchronizer(repository(), config(), statuses());
    }

    /** Committer name from {@code user.name}, empty when unset. */
    public String author() throws StoreException {
        return Strings.nullToEmpty(gitConfig().getString("user", null, "name"));
    }

    public boolean colorDisabled(boolean noColorFlag) throws StoreException {
        return noColorFlag
                || "false".equalsIgnoreCase(gitConfig().getString("color", null, "ui"))
                || "1".equals(env("NO_COLOR"));
    }

    public TaskPrinter printer(boolean noColorFlag) throws GitTaskException {
        return new TaskPrinter(statuses(), properties(), new SimpleExpressionEvaluator(), colorDisabled(noColorFlag),
                zone());
    }

    /** Fetch URLs of the git remotes by name. */
    public Map<String, String> remotes() throws StoreException {
        var config = gitConfig();
        var remotes = new LinkedHashMap<String, String>();
        for (String name : config.getSubsections("remote")) {
            String url = config.getString("remote", name, "url");
            if (url != null) {
                remotes.put(name, url);
            }
        }
        return remotes;
    }

    public RemoteTracker tracker(@Nullable String connector, @Nullable String remoteName) throws GitTaskException {
        TrackerKind kind = null;
        if (connector != null) {
            kind = TrackerKind.fromString(connector);
            if (kind == null) {
                throw new ValidationException("Unknown connector: " + connector);
            }
        }
        return trackerProvider.connect(config(), remotes(), kind, remoteName);
    }

    public String readStdin() throws ValidationException {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ValidationException("Can't read from pipe", e);
        }
    }

    /** Editor lookup order follows git: GIT_EDITOR, core.editor, VISUAL, EDITOR. */
    String editor() throws StoreException {
        for (String candidate : new String[] {
            env("GIT_EDITOR"), gitConfig().getString("core", null, "editor"), env("VISUAL"), env("EDITOR")
        }) {
            if (!Strings.isNullOrEmpty(candidate)) {
                return candidate;
            }
        }
        return DEFAULT_EDITOR;
    }

    /** Opens {@code initial} in the user's editor and returns the saved text, trailing newlines removed. */
    public String editText(String initial) throws GitTaskException {
        String editor = editor();
        Path file = null;
        try {
            file = Files.createTempFile("git-task", ".txt");
            Files.writeString(file, initial, StandardCharsets.UTF_8);
            var process = new ProcessBuilder("sh", "-c", editor + " \"$@\"", editor, file.toString())
                    .inheritIO()
                    .start();
            int exit = process.waitFor();
            if (exit != 0) {
                throw new ValidationException("Editing failed: " + editor + " exited with " + exit);
            }
            return Files.readString(file, StandardCharsets.UTF_8).stripTrailing();
        } catch (IOException e) {
            throw new ValidationException("Editing failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ValidationException("Editing interrupted", e);
        } finally {
            if (file != null) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    logger.warn("Could not delete {}", file, e);
                }
            }
        }
    }

    @Override
    public synchronized void close() {
        if (store != null) {
            store.close();
            store = null;
        }
    }
}
