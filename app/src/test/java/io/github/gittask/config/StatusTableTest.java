package io.github.gittask.config;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.exception.NotFoundException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.model.StatusDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class StatusTableTest {

    @Test
    void testDefaults() {
        var table = StatusTable.defaults();
        assertEquals(List.of("OPEN", "IN_PROGRESS", "CLOSED"),
                table.statuses().stream().map(StatusDefinition::name).toList());
        assertEquals("OPEN", table.starting().name());
        assertTrue(table.isClosing("CLOSED"));
        assertFalse(table.isClosing("IN_PROGRESS"));
        assertFalse(table.isClosing("NOT_A_STATUS"));
    }

    @Test
    void testCanonicalPrefersNameOverShortcut() throws Exception {
        var table = StatusTable.defaults().add(new StatusDefinition("c", "x", "Blue", false));
        assertEquals("c", table.canonical("c"), "An exact name wins over another status' shortcut");
        assertEquals("CLOSED", table.canonical("CLOSED"));
        assertEquals("IN_PROGRESS", table.canonical("i"));
        assertThrows(ValidationException.class, () -> table.canonical("closed"));
    }

    @Test
    void testValidation() {
        assertThrows(ValidationException.class, () -> new StatusTable(List.of()));
        assertThrows(ValidationException.class,
                () -> StatusTable.defaults().add(new StatusDefinition("OPEN", "z", "Red", false)));
        assertThrows(ValidationException.class,
                () -> StatusTable.defaults().add(new StatusDefinition("NEW", "o", "Red", false)));
        assertThrows(ValidationException.class,
                () -> StatusTable.defaults().add(new StatusDefinition("NEW", "ne", "Red", false)));
    }

    @Test
    void testSetFields() throws Exception {
        var table = StatusTable.defaults()
                .set("IN_PROGRESS", "color", "Blue")
                .set("IN_PROGRESS", "is_done", "true")
                .set("IN_PROGRESS", "name", "DOING");

        var doing = table.find("DOING").orElseThrow();
        assertEquals("Blue", doing.color());
        assertTrue(doing.closing());
        assertEquals(1, table.statuses().indexOf(doing), "Position is kept");
        assertEquals("true", StatusTable.getField(doing, "closing"));
        assertThrows(ValidationException.class, () -> StatusTable.defaults().set("OPEN", "closing", "maybe"));
        assertThrows(ValidationException.class, () -> StatusTable.defaults().set("OPEN", "weight", "1"));
        assertThrows(NotFoundException.class, () -> StatusTable.defaults().set("NOPE", "color", "Red"));
    }

    @Test
    void testRemove() throws Exception {
        var table = StatusTable.defaults().remove("OPEN");
        assertEquals("IN_PROGRESS", table.starting().name(), "The first remaining status becomes the starting one");
        assertThrows(NotFoundException.class, () -> table.remove("OPEN"));
    }

    @Test
    void testJsonRoundTripThroughConfig() throws Exception {
        var store = new MapConfigStore();
        var table = StatusTable.defaults().add(new StatusDefinition("BLOCKED", "Blocked!", "b", "Magenta", "bold", false));
        table.save(store);

        var loaded = StatusTable.load(TaskConfig.load(store, name -> null));
        assertEquals(table.statuses(), loaded.statuses());
        assertEquals("Blocked!", loaded.find("BLOCKED").orElseThrow().label());

        StatusTable.reset(store);
        assertEquals(StatusTable.defaults().statuses(), StatusTable.load(TaskConfig.load(store, name -> null)).statuses());
    }

    @Test
    void testInvalidJson() {
        var config = TaskConfig.of(Map.of(TaskConfig.STATUSES, "[{\"name\":"));
        assertThrows(ValidationException.class, () -> StatusTable.load(config));
    }
}
