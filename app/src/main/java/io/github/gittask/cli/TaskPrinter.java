package io.github.gittask.cli;

import io.github.gittask.config.PropertyTable;
import io.github.gittask.config.StatusTable;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.Comment;
import io.github.gittask.model.Label;
import io.github.gittask.model.PropertyDefinition;
import io.github.gittask.model.PropertyDefinition.ValueType;
import io.github.gittask.model.Task;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine.Help.Ansi;

/** Renders tasks for the terminal, colored by the status and property tables unless colors are off. */
public class TaskPrinter {
    private static final Logger logger = LogManager.getLogger(TaskPrinter.class);

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String TITLE_COLOR = "DarkGray";
    private static final Set<String> SHOWN_FIRST =
            Set.of("id", Task.NAME, Task.STATUS, Task.DESCRIPTION, Task.CREATED, Task.AUTHOR);

    private static final Map<String, String> NAMED_COLORS = Map.ofEntries(
            Map.entry("black", "fg(black)"),
            Map.entry("red", "fg(red)"),
            Map.entry("green", "fg(green)"),
            Map.entry("yellow", "fg(yellow)"),
            Map.entry("blue", "fg(blue)"),
            Map.entry("purple", "fg(magenta)"),
            Map.entry("magenta", "fg(magenta)"),
            Map.entry("cyan", "fg(cyan)"),
            Map.entry("white", "fg(white)"),
            Map.entry("lightgray", "fg(7)"),
            Map.entry("lightgrey", "fg(7)"),
            Map.entry("darkgray", "fg(8)"),
            Map.entry("darkgrey", "fg(8)"),
            Map.entry("lightred", "fg(9)"),
            Map.entry("lightgreen", "fg(10)"),
            Map.entry("lightyellow", "fg(11)"),
            Map.entry("lightblue", "fg(12)"),
            Map.entry("lightpurple", "fg(13)"),
            Map.entry("lightmagenta", "fg(13)"),
            Map.entry("lightcyan", "fg(14)"));

    private final StatusTable statuses;
    private final PropertyTable properties;
    private final ExpressionEvaluator evaluator;
    private final boolean noColor;
    private final ZoneId zone;

    public TaskPrinter(StatusTable statuses, PropertyTable properties, ExpressionEvaluator evaluator, boolean noColor,
            ZoneId zone) {
        this.statuses = statuses;
        this.properties = properties;
        this.evaluator = evaluator;
        this.noColor = noColor;
        this.zone = zone;
    }

    /**
     * Translates a color name, a 256-color index or a {@code #rrggbb} value plus a comma-separated style list into
     * picocli style names. {@code Default} and unknown colors yield no color.
     */
    static List<String> styleNames(@Nullable String color, @Nullable String style) {
        var names = new ArrayList<String>();
        if (color != null && !color.isBlank()) {
            String key = color.trim().toLowerCase(Locale.ROOT);
            String named = NAMED_COLORS.get(key);
            if (named != null) {
                names.add(named);
            } else if (key.chars().allMatch(Character::isDigit) && key.length() <= 3 && Integer.parseInt(key) < 256) {
                names.add("fg(" + key + ")");
            } else {
                String rgb = toCube(key);
                if (rgb != null) {
                    names.add("fg(" + rgb + ")");
                }
            }
        }
        if (style != null) {
            for (String part : style.split(",")) {
                switch (part.trim().toLowerCase(Locale.ROOT)) {
                    case "bold" -> names.add("bold");
                    case "dimmed" -> names.add("faint");
                    case "italic" -> names.add("italic");
                    case "underline" -> names.add("underline");
                    // no strikethrough in the 16-color style set
                    default -> { }
                }
            }
        }
        return names;
    }

    /** Maps {@code #rrggbb} onto the 6x6x6 cube of the 256-color palette, as {@code r;g;b}. */
    private static @Nullable String toCube(String hex) {
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() != 6) {
            return null;
        }
        try {
            int value = Integer.parseInt(digits, 16);
            int r = ((value >> 16) & 0xff) * 5 / 255;
            int g = ((value >> 8) & 0xff) * 5 / 255;
            int b = (value & 0xff) * 5 / 255;
            return r + ";" + g + ";" + b;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public String colorize(String text, @Nullable String color, @Nullable String style) {
        if (noColor || text.isEmpty()) {
            return text;
        }
        var names = styleNames(color, style);
        if (names.isEmpty()) {
            return text;
        }
        var styles = Ansi.Style.parse(String.join(",", names));
        return Ansi.Style.on(styles) + text + Ansi.Style.off(styles);
    }

    private String title(String text) {
        return colorize(text, TITLE_COLOR, null);
    }

    public String formatStatus(String status) {
        return statuses.find(status)
                .map(s -> colorize(s.label(), s.color(), s.style()))
                .orElse(status);
    }

    /** Formats {@code value} of {@code property}; the first matching condition overrides the property's color. */
    public String formatValue(String property, String value, Map<String, String> context) {
        var definition = properties.find(property).orElse(null);
        if (definition == null) {
            return value;
        }
        String text = definition.valueType() == ValueType.DATETIME ? formatDateTime(value) : value;
        String color = definition.color();
        String style = definition.style();
        if (definition.valueType() == ValueType.ENUM) {
            for (PropertyDefinition.EnumValue enumValue : definition.enumValues()) {
                if (enumValue.name().equals(value)) {
                    color = enumValue.color();
                    style = enumValue.style();
                    break;
                }
            }
        }
        for (PropertyDefinition.Condition condition : definition.conditions()) {
            try {
                if (evaluator.test(condition.condition(), context)) {
                    color = condition.color();
                    style = condition.style();
                    break;
                }
            } catch (ValidationException e) {
                logger.debug("Ignoring condition of property {}: {}", property, e.getMessage());
            }
        }
        return colorize(text, color, style);
    }

    String formatDateTime(String epochSeconds) {
        try {
            long seconds = Long.parseLong(epochSeconds.trim());
            if (seconds == 0) {
                return "";
            }
            return DATE_TIME.format(Instant.ofEpochSecond(seconds).atZone(zone));
        } catch (NumberFormatException e) {
            return epochSeconds;
        }
    }

    public String formatLabel(Label label) {
        return colorize(label.name(), label.color(), null);
    }

    /** Task properties plus {@code id}, the variables of formatting conditions. */
    public static Map<String, String> context(Task task) {
        var context = new LinkedHashMap<>(task.properties());
        context.put("id", Long.toString(task.id()));
        return context;
    }

    public String line(Task task, List<String> columns) {
        var context = context(task);
        var parts = new ArrayList<String>();
        for (String column : columns) {
            String value = context.getOrDefault(column, "");
            parts.add(column.equals(Task.STATUS) ? formatStatus(value) : formatValue(column, value, context));
        }
        return String.join(" ", parts);
    }

    public String details(Task task) {
        var context = context(task);
        var lines = new ArrayList<String>();
        lines.add(title("ID") + ": " + task.id());
        String created = task.getPropertyOrEmpty(Task.CREATED);
        if (!created.isEmpty()) {
            lines.add(title("Created") + ": " + formatDateTime(created));
        }
        String author = task.getPropertyOrEmpty(Task.AUTHOR);
        if (!author.isEmpty()) {
            lines.add(title("Author") + ": " + formatValue(Task.AUTHOR, author, context));
        }
        lines.add(title("Name") + ": " + formatValue(Task.NAME, task.name(), context));
        if (!task.labels().isEmpty()) {
            var labels = task.labels().stream().map(this::formatLabel).toList();
            lines.add(title("Labels") + ": " + String.join(" ", labels));
        }
        lines.add(title("Status") + ": " + formatStatus(task.status()));
        task.properties().forEach((name, value) -> {
            if (!SHOWN_FIRST.contains(name)) {
                lines.add(title(capitalize(name)) + ": " + formatValue(name, value, context));
            }
        });
        task.links().forEach((kind, remoteId) -> lines.add(title(kind.getDisplayName()) + ": " + remoteId));
        String description = task.getPropertyOrEmpty(Task.DESCRIPTION);
        if (!description.isEmpty()) {
            lines.add(title("Description") + ": " + formatValue(Task.DESCRIPTION, description, context));
        }
        for (Comment comment : task.comments()) {
            lines.add(title("---------------"));
            lines.add(title("Comment ID") + ": " + comment.id());
            if (comment.created() > 0) {
                lines.add(title("Created") + ": " + formatDateTime(Long.toString(comment.created())));
            }
            if (!comment.author().isEmpty()) {
                lines.add(title("Author") + ": " + formatValue(Task.AUTHOR, comment.author(), context));
            }
            lines.add(comment.text());
        }
        return String.join(System.lineSeparator(), lines);
    }

    static String capitalize(String text) {
        if (text.isEmpty()) {
            return text;
        }
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1);
    }
}
