package io.github.gittask.cli;

import io.github.gittask.exception.ValidationException;
import java.util.Map;

/** Evaluates the conditions of conditional property formatting against a task's values. */
public interface ExpressionEvaluator {
    boolean test(String expression, Map<String, String> variables) throws ValidationException;
}
