package io.github.gittask.store;

/** One path-level change applied on top of the previous tree. */
public sealed interface TreeMutation permits TreeMutation.Put, TreeMutation.Delete {
    String path();

    record Put(String path, byte[] content) implements TreeMutation {}

    record Delete(String path) implements TreeMutation {}

    static TreeMutation put(String path, byte[] content) {
        return new Put(path, content);
    }

    static TreeMutation delete(String path) {
        return new Delete(path);
    }
}
