package io.github.gittask.config;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.PropertyDefinition;
import io.github.gittask.model.PropertyDefinition.Condition;
import io.github.gittask.model.PropertyDefinition.EnumValue;
import io.github.gittask.model.PropertyDefinition.ValueType;
import java.util.List;
import org.junit.jupiter.api.Test;

public class PropertyTableTest {

    @Test
    void testUndeclaredPropertiesAreStrings() {
        var table = PropertyTable.defaults();
        assertEquals(ValueType.DATETIME, table.valueType("created"));
        assertEquals(ValueType.STRING, table.valueType("priority"));
    }

    @Test
    void testEnumAndConditionsSurviveJson() throws Exception {
        var priority = new PropertyDefinition("priority", ValueType.ENUM, "Default")
                .withEnumValues(List.of(new EnumValue("HIGH", "Red", "bold"), new EnumValue("LOW", "Green", null)))
                .withConditions(List.of(new Condition("status == \"CLOSED\"", "DarkGray", "dimmed")));
        var table = PropertyTable.defaults().add(priority);

        var store = new MapConfigStore();
        table.save(store);
        var loaded = PropertyTable.load(TaskConfig.load(store, name -> null));

        assertEquals(priority, loaded.find("priority").orElseThrow());
        assertFalse(store.get(TaskConfig.PROPERTIES).orElseThrow().contains("\"enumValues\":[]"),
                "Empty lists are omitted from the stored JSON");
    }

    @Test
    void testSetAndRename() throws Exception {
        var table = PropertyTable.defaults()
                .set("author", "type", "text")
                .set("author", "style", "italic")
                .set("author", "name", "owner");

        var owner = table.find("owner").orElseThrow();
        assertEquals(ValueType.TEXT, owner.valueType());
        assertEquals("italic", owner.style());
        assertEquals(3, table.properties().indexOf(owner));
        assertEquals("text", PropertyTable.getField(owner, "value_type"));
    }

    @Test
    void testErrors() {
        assertThrows(ValidationException.class, () -> PropertyTable.defaults().set("author", "type", "float"));
        assertThrows(ValidationException.class, () -> PropertyTable.defaults().set("author", "width", "3"));
        assertThrows(NotFoundException.class, () -> PropertyTable.defaults().set("nope", "color", "Red"));
        assertThrows(NotFoundException.class, () -> PropertyTable.defaults().remove("nope"));
        assertThrows(ValidationException.class,
                () -> PropertyTable.defaults().add(new PropertyDefinition("name", ValueType.STRING, "Red")));
        assertThrows(ValidationException.class, () -> PropertyTable.fromJson("{"));
    }
}
