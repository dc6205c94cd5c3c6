package io.github.gittask.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.gittask.exception.EncodingException;
import io.github.gittask.model.Comment;
import io.github.gittask.model.Label;
import io.github.gittask.model.Task;
import io.github.gittask.remote.TrackerKind;
import io.github.gittask.util.Json;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * JSON encoding of task records. Properties are written in insertion order and read back in document order, so a
 * decode/encode cycle reproduces the blob byte for byte.
 */
public class TaskCodec {
    static final String ID = "id";
    static final String PROPS = "props";
    static final String COMMENTS = "comments";
    static final String LABELS = "labels";
    static final String LINKS = "links";
    static final String LAST_ID = "lastId";

    private final ObjectMapper mapper;

    public TaskCodec() {
        this(Json.mapper());
    }

    public TaskCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toTree(Task task) {
        var root = mapper.createObjectNode();
        root.put(ID, task.id());
        var props = root.putObject(PROPS);
        task.properties().forEach(props::put);
        if (!task.comments().isEmpty()) {
            ArrayNode comments = root.putArray(COMMENTS);
            for (Comment comment : task.comments()) {
                var node = comments.addObject();
                node.put("id", comment.id());
                node.put("author", comment.author());
                node.put("created", comment.created());
                node.put("text", comment.text());
                putLinks(node, comment.links());
            }
        }
        if (!task.labels().isEmpty()) {
            ArrayNode labels = root.putArray(LABELS);
            for (Label label : task.labels()) {
                var node = labels.addObject();
                node.put("name", label.name());
                node.put("color", label.color());
                if (label.description() != null) {
                    node.put("description", label.description());
                }
                putLinks(node, label.links());
            }
        }
        putLinks(root, task.links());
        return root;
    }

    private static void putLinks(ObjectNode node, Map<TrackerKind, String> links) {
        if (links.isEmpty()) {
            return;
        }
        var linksNode = node.putObject(LINKS);
        links.forEach((kind, remoteId) -> linksNode.put(kind.key(), remoteId));
    }

    public byte[] encode(Task task) throws EncodingException {
        try {
            return mapper.writeValueAsBytes(toTree(task));
        } catch (JsonProcessingException e) {
            throw new EncodingException("Failed to encode task " + task.id(), e);
        }
    }

    public Task decode(byte[] content) throws EncodingException {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException e) {
            throw new EncodingException("Malformed task record: " + e.getMessage(), e);
        }
        return fromTree(root);
    }

    public Task fromTree(@Nullable JsonNode root) throws EncodingException {
        if (root == null || !root.isObject()) {
            throw new EncodingException("Task record must be a JSON object");
        }
        var task = new Task(requireLong(root, ID, "task"));
        var props = root.get(PROPS);
        if (props != null) {
            if (!props.isObject()) {
                throw new EncodingException("Properties of task " + task.id() + " must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = props.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                task.setProperty(field.getKey(), field.getValue().asText());
            }
        }
        for (JsonNode node : root.path(COMMENTS)) {
            task.addComment(new Comment(
                    requireLong(node, "id", "comment"),
                    node.path("author").asText(""),
                    node.path("created").asLong(0),
                    node.path("text").asText(""),
                    readLinks(node)));
        }
        for (JsonNode node : root.path(LABELS)) {
            var name = node.path("name").asText("");
            if (name.isEmpty()) {
                throw new EncodingException("Label without a name in task " + task.id());
            }
            var description = node.hasNonNull("description") ? node.get("description").asText() : null;
            task.putLabel(new Label(name, node.path("color").asText(Label.DEFAULT_COLOR), description, readLinks(node)));
        }
        readLinks(root).forEach(task::setLink);
        return task;
    }

    private static long requireLong(JsonNode node, String field, String what) throws EncodingException {
        var value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new EncodingException("Missing or invalid " + field + " in " + what + " record");
        }
        return value.asLong();
    }

    private static Map<TrackerKind, String> readLinks(JsonNode node) throws EncodingException {
        var result = new EnumMap<TrackerKind, String>(TrackerKind.class);
        Iterator<Map.Entry<String, JsonNode>> fields = node.path(LINKS).fields();
        while (fields.hasNext()) {
            var field = fields.next();
            var kind = TrackerKind.fromString(field.getKey());
            if (kind == null) {
                throw new EncodingException("Unknown tracker kind in link: " + field.getKey());
            }
            result.put(kind, field.getValue().asText());
        }
        return result;
    }

    public byte[] encodeMeta(long lastId) throws EncodingException {
        try {
            var node = mapper.createObjectNode();
            node.put(LAST_ID, lastId);
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new EncodingException("Failed to encode repository metadata", e);
        }
    }

    public long decodeMeta(byte[] content) throws EncodingException {
        try {
            var node = mapper.readTree(new String(content, StandardCharsets.UTF_8));
            return node.path(LAST_ID).asLong(0);
        } catch (JsonProcessingException e) {
            throw new EncodingException("Malformed repository metadata: " + e.getOriginalMessage(), e);
        }
    }
}
