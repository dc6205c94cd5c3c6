package io.github.gittask.remote;

import java.util.Locale;
import java.util.Map;

/** Translates the color names used for local labels into the hex form trackers store. */
public final class LabelColors {
    public static final String DEFAULT_HEX = "ededed";

    private static final Map<String, String> NAMED = Map.ofEntries(
            Map.entry("black", "000000"),
            Map.entry("red", "d73a4a"),
            Map.entry("green", "0e8a16"),
            Map.entry("yellow", "fbca04"),
            Map.entry("blue", "1d76db"),
            Map.entry("purple", "5319e7"),
            Map.entry("magenta", "b60205"),
            Map.entry("cyan", "17becf"),
            Map.entry("white", "ffffff"),
            Map.entry("darkgray", "555555"),
            Map.entry("lightgray", "cccccc"),
            Map.entry("lightred", "f9d0c4"),
            Map.entry("lightgreen", "c2e0c6"),
            Map.entry("lightyellow", "fef2c0"),
            Map.entry("lightblue", "bfdadc"),
            Map.entry("lightpurple", "d4c5f9"),
            Map.entry("lightcyan", "c5def5"));

    private LabelColors() {}

    /** Six lowercase hex digits without a leading {@code #}. */
    public static String toHex(String color) {
        String value = color.trim();
        if (value.startsWith("#")) {
            value = value.substring(1);
        }
        if (value.matches("[0-9a-fA-F]{6}")) {
            return value.toLowerCase(Locale.ROOT);
        }
        return NAMED.getOrDefault(value.toLowerCase(Locale.ROOT).replace("_", ""), DEFAULT_HEX);
    }
}
