package io.github.gittask.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.gittask.exception.EncodingException;
import io.github.gittask.model.Task;
import io.github.gittask.util.Json;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Bulk JSON form of full task records, used by {@code export} and {@code import}. */
public class TaskDocument {
    private final TaskCodec codec;
    private final ObjectMapper mapper;

    public TaskDocument(TaskCodec codec) {
        this.codec = codec;
        this.mapper = Json.mapper();
    }

    public String write(List<Task> tasks, boolean pretty) throws EncodingException {
        var array = mapper.createArrayNode();
        tasks.forEach(task -> array.add(codec.toTree(task)));
        try {
            return pretty ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(array) : mapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new EncodingException("Failed to serialize task list", e);
        }
    }

    /**
     * Parses a JSON array of task records, or a single record.
     *
     * @param only IDs to keep; null keeps every record
     */
    public List<Task> read(String json, @Nullable Collection<Long> only) throws EncodingException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EncodingException("Can't deserialize input: " + e.getOriginalMessage(), e);
        }
        var result = new ArrayList<Task>();
        if (root != null && root.isObject()) {
            addIfSelected(result, codec.fromTree(root), only);
            return result;
        }
        if (root == null || !root.isArray()) {
            throw new EncodingException("Expected a JSON array of tasks");
        }
        for (JsonNode node : root) {
            addIfSelected(result, codec.fromTree(node), only);
        }
        return result;
    }

    private static void addIfSelected(List<Task> result, Task task, @Nullable Collection<Long> only) {
        if (only == null || only.contains(task.id())) {
            result.add(task);
        }
    }
}
