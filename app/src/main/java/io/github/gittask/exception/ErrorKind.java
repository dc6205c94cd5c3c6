package io.github.gittask.exception;

public enum ErrorKind {
    NOT_FOUND,
    VALIDATION,
    CONCURRENT_MODIFICATION,
    REMOTE_FAILURE,
    UNSUPPORTED_OPERATION,
    ENCODING;

    public String getDisplayName() {
        return switch (this) {
            case NOT_FOUND -> "NotFound";
            case VALIDATION -> "ValidationError";
            case CONCURRENT_MODIFICATION -> "ConcurrentModification";
            case REMOTE_FAILURE -> "RemoteFailure";
            case UNSUPPORTED_OPERATION -> "UnsupportedOperation";
            case ENCODING -> "EncodingError";
        };
    }
}
