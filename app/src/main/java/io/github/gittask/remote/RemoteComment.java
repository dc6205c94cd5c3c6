package io.github.gittask.remote;

/** @param created epoch seconds */
public record RemoteComment(String id, String author, long created, String body) {}
