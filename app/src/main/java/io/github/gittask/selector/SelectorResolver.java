package io.github.gittask.selector;

import io.github.gittask.config.StatusTable;
import io.github.gittask.exception.ValidationException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parses ID selectors such as {@code 2..5,10,12} and status lists such as {@code o,IN_PROGRESS}.
 */
public final class SelectorResolver {
    private static final String RANGE = "..";

    /** Most IDs a single selector may denote. */
    public static final int MAX_IDS = 100_000;

    private SelectorResolver() {}

    /**
     * @return strictly increasing IDs without duplicates; empty for a blank selector
     * @throws ValidationException on a malformed token, a range whose lower bound exceeds the upper one, or a
     *     selector denoting more than {@link #MAX_IDS} IDs
     */
    public static List<Long> parse(String selector) throws ValidationException {
        var ids = new TreeSet<Long>();
        if (selector.isBlank()) {
            return List.of();
        }
        for (String raw : selector.split(",")) {
            String token = raw.trim();
            if (token.isEmpty()) {
                throw new ValidationException("Empty token in selector '" + selector + "'");
            }
            int range = token.indexOf(RANGE);
            if (range < 0) {
                ids.add(parseId(token, selector));
                continue;
            }
            long lo = parseId(token.substring(0, range).trim(), selector);
            long hi = parseId(token.substring(range + RANGE.length()).trim(), selector);
            if (lo > hi) {
                throw new ValidationException("Invalid range " + token + ": " + lo + " is greater than " + hi);
            }
            if (hi - lo >= MAX_IDS - ids.size()) {
                throw new ValidationException("Range " + token + " selects more than " + MAX_IDS + " IDs");
            }
            for (long offset = 0; offset <= hi - lo; offset++) {
                ids.add(lo + offset);
            }
        }
        return List.copyOf(ids);
    }

    private static long parseId(String token, String selector) throws ValidationException {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
            throw new ValidationException("Invalid ID '" + token + "' in selector '" + selector + "'");
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            throw new ValidationException("ID out of range: " + token, e);
        }
    }

    /**
     * Resolves comma-separated status names or shortcuts, case-sensitively, to canonical names in the order given.
     */
    public static Set<String> resolveStatuses(String statuses, StatusTable table) throws ValidationException {
        return resolveStatuses(List.of(statuses.split(",")), table);
    }

    public static Set<String> resolveStatuses(List<String> statuses, StatusTable table) throws ValidationException {
        var result = new LinkedHashSet<String>();
        for (String raw : statuses) {
            for (String part : raw.split(",")) {
                String status = part.trim();
                if (!status.isEmpty()) {
                    result.add(table.canonical(status));
                }
            }
        }
        return result;
    }
}
