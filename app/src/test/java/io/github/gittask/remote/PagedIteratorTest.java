package io.github.gittask.remote;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.RemoteFailureException.Reason;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

public class PagedIteratorTest {

    private static List<Integer> drain(PagedIterator<Integer> iterator) {
        var items = new ArrayList<Integer>();
        iterator.forEachRemaining(items::add);
        return items;
    }

    @Test
    void testFetchesPagesOnDemand() {
        var fetched = new ArrayList<Integer>();
        var iterator = new PagedIterator<Integer>(page -> {
            fetched.add(page);
            return page < 2 ? PagedIterator.Page.of(List.of(page * 2, page * 2 + 1), 2, 2) : PagedIterator.Page.of(List.of(), 0, 2);
        }, null);

        assertTrue(fetched.isEmpty(), "Nothing is fetched before the first hasNext");
        assertEquals(0, iterator.next());
        assertEquals(1, iterator.next());
        assertEquals(List.of(0), fetched);

        assertEquals(List.of(2, 3), drain(iterator));
        assertEquals(List.of(0, 1, 2), fetched, "A short page ends the listing");
        assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    void testLimitStopsFetching() {
        var fetched = new ArrayList<Integer>();
        var iterator = new PagedIterator<Integer>(page -> {
            fetched.add(page);
            return new PagedIterator.Page<>(List.of(page * 10, page * 10 + 1, page * 10 + 2), false);
        }, 4);

        assertEquals(List.of(0, 1, 2, 10), drain(iterator));
        assertEquals(List.of(0, 1), fetched);
    }

    @Test
    void testEmptyFilteredPagesAreSkipped() {
        // trackers filter client side, so a full page may contribute nothing
        var iterator = new PagedIterator<Integer>(page -> switch (page) {
            case 0 -> new PagedIterator.Page<>(List.of(), false);
            case 1 -> new PagedIterator.Page<>(List.of(7), false);
            default -> new PagedIterator.Page<>(List.of(), true);
        }, null);

        assertEquals(List.of(7), drain(iterator));
    }

    @Test
    void testSinglesSkipMissingIds() {
        var iterator = PagedIterator.ofSingles(List.of("1", "2", "3"),
                id -> id.equals("2") ? null : Integer.valueOf(id), null);

        assertEquals(List.of(1, 3), drain(iterator));
        assertFalse(PagedIterator.ofSingles(List.of(), Integer::valueOf, null).hasNext());
    }

    @Test
    void testFailureIsCarriedUnchecked() {
        var failure = new RemoteFailureException(TrackerKind.GITHUB, Reason.NETWORK, true, "connection reset");
        var iterator = new PagedIterator<Integer>(page -> {
            if (page > 0) {
                throw failure;
            }
            return new PagedIterator.Page<>(List.of(1), false);
        }, null);

        assertEquals(1, iterator.next());
        var e = assertThrows(RemoteFailureException.Unchecked.class, iterator::hasNext);
        assertSame(failure, e.getCause());
        assertFalse(iterator.hasNext(), "A failed listing does not retry on its own");
    }
}
