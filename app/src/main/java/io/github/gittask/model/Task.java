package io.github.gittask.model;

import io.github.gittask.remote.TrackerKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A task record. Properties keep insertion order and accept any key; the reserved keys are listed as constants.
 * Instances are mutable working copies: the repository hands out fresh copies on every read.
 */
public final class Task {
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String AUTHOR = "author";
    public static final String CREATED = "created";
    public static final String STATUS = "status";

    private long id;
    private final LinkedHashMap<String, String> props = new LinkedHashMap<>();
    private final List<Comment> comments = new ArrayList<>();
    private final List<Label> labels = new ArrayList<>();
    private final EnumMap<TrackerKind, String> links = new EnumMap<>(TrackerKind.class);

    public Task(long id) {
        this.id = id;
    }

    /** A draft without an ID yet; the repository assigns one when the task is created. */
    public static Task draft(String name, String description, String status) {
        var task = new Task(0);
        task.setProperty(NAME, name);
        task.setProperty(DESCRIPTION, description);
        task.setProperty(STATUS, status);
        return task;
    }

    public long id() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public @Nullable String getProperty(String name) {
        return props.get(name);
    }

    public String getPropertyOrEmpty(String name) {
        return props.getOrDefault(name, "");
    }

    public void setProperty(String name, String value) {
        props.put(name, value);
    }

    public boolean removeProperty(String name) {
        return props.remove(name) != null;
    }

    public Map<String, String> properties() {
        return Collections.unmodifiableMap(props);
    }

    public String name() {
        return getPropertyOrEmpty(NAME);
    }

    public String status() {
        return getPropertyOrEmpty(STATUS);
    }

    public List<Comment> comments() {
        return Collections.unmodifiableList(comments);
    }

    public Optional<Comment> findComment(long commentId) {
        return comments.stream().filter(c -> c.id() == commentId).findFirst();
    }

    public Optional<Comment> findCommentByLink(TrackerKind kind, String remoteId) {
        return comments.stream()
                .filter(c -> remoteId.equals(c.links().get(kind)))
                .findFirst();
    }

    public long nextCommentId() {
        return comments.stream().mapToLong(Comment::id).max().orElse(0) + 1;
    }

    public void addComment(Comment comment) {
        comments.add(comment);
    }

    public boolean replaceComment(Comment comment) {
        for (int i = 0; i < comments.size(); i++) {
            if (comments.get(i).id() == comment.id()) {
                comments.set(i, comment);
                return true;
            }
        }
        return false;
    }

    public boolean removeComment(long commentId) {
        return comments.removeIf(c -> c.id() == commentId);
    }

    public List<Label> labels() {
        return Collections.unmodifiableList(labels);
    }

    public Optional<Label> findLabel(String name) {
        return labels.stream().filter(l -> l.name().equals(name)).findFirst();
    }

    /** Adds the label, or replaces the one with the same name in place. */
    public void putLabel(Label label) {
        for (int i = 0; i < labels.size(); i++) {
            if (labels.get(i).name().equals(label.name())) {
                labels.set(i, label);
                return;
            }
        }
        labels.add(label);
    }

    public boolean removeLabel(String name) {
        return labels.removeIf(l -> l.name().equals(name));
    }

    public void setLabels(List<Label> newLabels) {
        labels.clear();
        newLabels.forEach(this::putLabel);
    }

    public Map<TrackerKind, String> links() {
        return Collections.unmodifiableMap(links);
    }

    public Optional<String> link(TrackerKind kind) {
        return Optional.ofNullable(links.get(kind));
    }

    public void setLink(TrackerKind kind, String remoteId) {
        links.put(kind, remoteId);
    }

    public Task copy() {
        var copy = new Task(id);
        copy.props.putAll(props);
        copy.comments.addAll(comments);
        copy.labels.addAll(labels);
        copy.links.putAll(links);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task other)) return false;
        return id == other.id
                && props.equals(other.props)
                // insertion order is part of the record
                && List.copyOf(props.keySet()).equals(List.copyOf(other.props.keySet()))
                && comments.equals(other.comments)
                && labels.equals(other.labels)
                && links.equals(other.links);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, props, comments, labels, links);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", props=" + props + ", comments=" + comments.size() + ", labels="
                + labels.size() + ", links=" + links + "}";
    }
}
