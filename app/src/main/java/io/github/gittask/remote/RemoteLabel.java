package io.github.gittask.remote;

import org.jetbrains.annotations.Nullable;

public record RemoteLabel(String name, String color, @Nullable String description) {}
