package io.github.gittask.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/** Presentation rules for one task property. Never restricts which keys a task may hold. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record PropertyDefinition(
        String name,
        ValueType valueType,
        String color,
        @Nullable String style,
        List<EnumValue> enumValues,
        List<Condition> conditions) {

    public enum ValueType {
        STRING,
        TEXT,
        INTEGER,
        DATETIME,
        ENUM;

        public static ValueType parse(String text) {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EnumValue(String name, String color, @Nullable String style) {}

    /** Styling applied when {@code condition} evaluates to true against the task's properties. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Condition(String condition, String color, @Nullable String style) {}

    public PropertyDefinition {
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public PropertyDefinition(String name, ValueType valueType, String color) {
        this(name, valueType, color, null, List.of(), List.of());
    }

    public PropertyDefinition withColor(String newColor) {
        return new PropertyDefinition(name, valueType, newColor, style, enumValues, conditions);
    }

    public PropertyDefinition withStyle(@Nullable String newStyle) {
        return new PropertyDefinition(name, valueType, color, newStyle, enumValues, conditions);
    }

    public PropertyDefinition withValueType(ValueType newType) {
        return new PropertyDefinition(name, newType, color, style, enumValues, conditions);
    }

    public PropertyDefinition withEnumValues(List<EnumValue> values) {
        return new PropertyDefinition(name, valueType, color, style, values, conditions);
    }

    public PropertyDefinition withConditions(List<Condition> newConditions) {
        return new PropertyDefinition(name, valueType, color, style, enumValues, newConditions);
    }
}
