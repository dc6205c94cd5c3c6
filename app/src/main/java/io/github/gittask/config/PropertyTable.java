package io.github.gittask.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.StoreException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.PropertyDefinition;
import io.github.gittask.model.PropertyDefinition.ValueType;
import io.github.gittask.util.Json;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Presentation rules per property name, stored as JSON under {@code task.properties}. */
public final class PropertyTable {
    private final List<PropertyDefinition> properties;

    public PropertyTable(List<PropertyDefinition> properties) throws ValidationException {
        var names = new HashSet<String>();
        for (PropertyDefinition property : properties) {
            if (property.name() == null || property.name().isBlank()) {
                throw new ValidationException("Property name must not be blank");
            }
            if (property.valueType() == null) {
                throw new ValidationException("Property " + property.name() + " has no value type");
            }
            if (!names.add(property.name())) {
                throw new ValidationException("Duplicate property: " + property.name());
            }
        }
        this.properties = List.copyOf(properties);
    }

    public static PropertyTable defaults() {
        try {
            return new PropertyTable(List.of(
                    new PropertyDefinition("id", ValueType.INTEGER, "DarkGray"),
                    new PropertyDefinition("name", ValueType.STRING, "Default"),
                    new PropertyDefinition("created", ValueType.DATETIME, "239"),
                    new PropertyDefinition("author", ValueType.STRING, "Cyan"),
                    new PropertyDefinition("description", ValueType.TEXT, "Default")));
        } catch (ValidationException e) {
            throw new AssertionError(e);
        }
    }

    public static PropertyTable load(TaskConfig config) throws ValidationException {
        var json = config.values().get(TaskConfig.PROPERTIES);
        return json == null || json.isBlank() ? defaults() : fromJson(json);
    }

    public static PropertyTable fromJson(String json) throws ValidationException {
        try {
            return new PropertyTable(Json.fromJson(json, new TypeReference<List<PropertyDefinition>>() {}));
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid property table: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(boolean pretty) {
        try {
            return Json.toJson(properties, pretty);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Property definitions must serialize", e);
        }
    }

    public void save(ConfigStore store) throws StoreException {
        store.set(TaskConfig.PROPERTIES, toJson(false));
    }

    public static void reset(ConfigStore store) throws StoreException {
        store.unset(TaskConfig.PROPERTIES);
    }

    public List<PropertyDefinition> properties() {
        return properties;
    }

    public Optional<PropertyDefinition> find(String name) {
        return properties.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /** Undeclared properties are plain strings. */
    public ValueType valueType(String name) {
        return find(name).map(PropertyDefinition::valueType).orElse(ValueType.STRING);
    }

    public PropertyTable add(PropertyDefinition property) throws ValidationException {
        var updated = new ArrayList<>(properties);
        updated.add(property);
        return new PropertyTable(updated);
    }

    public PropertyTable remove(String name) throws ValidationException, NotFoundException {
        var updated = new ArrayList<>(properties);
        if (!updated.removeIf(p -> p.name().equals(name))) {
            throw new NotFoundException("Property " + name + " not found");
        }
        return new PropertyTable(updated);
    }

    public static String getField(PropertyDefinition property, String field) throws ValidationException {
        return switch (field.toLowerCase(Locale.ROOT)) {
            case "name" -> property.name();
            case "value_type", "valuetype", "type" -> property.valueType().name().toLowerCase(Locale.ROOT);
            case "color" -> property.color();
            case "style" -> property.style() == null ? "" : property.style();
            default -> throw new ValidationException("Unknown property field: " + field);
        };
    }

    public PropertyTable set(String name, String field, String value) throws ValidationException, NotFoundException {
        var current = find(name).orElseThrow(() -> new NotFoundException("Property " + name + " not found"));
        PropertyDefinition changed;
        switch (field.toLowerCase(Locale.ROOT)) {
            case "value_type", "valuetype", "type" -> {
                try {
                    changed = current.withValueType(ValueType.parse(value));
                } catch (IllegalArgumentException e) {
                    throw new ValidationException("Unknown value type: " + value, e);
                }
            }
            case "name" -> changed = new PropertyDefinition(value, current.valueType(), current.color(), current.style(),
                    current.enumValues(), current.conditions());
            case "color" -> changed = current.withColor(value);
            case "style" -> changed = current.withStyle(value.isBlank() ? null : value);
            default -> throw new ValidationException("Unknown property field: " + field);
        }
        return replace(name, changed);
    }

    /** Swaps the definition named {@code name} for {@code changed}, keeping its position. */
    public PropertyTable replace(String name, PropertyDefinition changed) throws ValidationException, NotFoundException {
        if (find(name).isEmpty()) {
            throw new NotFoundException("Property " + name + " not found");
        }
        var updated = new ArrayList<PropertyDefinition>();
        for (PropertyDefinition property : properties) {
            updated.add(property.name().equals(name) ? changed : property);
        }
        return new PropertyTable(updated);
    }
}
