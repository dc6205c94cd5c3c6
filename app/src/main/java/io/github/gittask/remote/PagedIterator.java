package io.github.gittask.remote;

import io.github.gittask.exception.RemoteFailureException;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.Nullable;

/**
 * Iterator over a paginated listing that fetches page {@code n} only once page {@code n - 1} is consumed. Paging
 * stops after a page marked last, or once {@code limit} items have been returned.
 */
public final class PagedIterator<T> implements Iterator<T> {

    /**
     * @param items the usable entries of the page, possibly fewer than the tracker returned
     * @param last whether no further page exists
     */
    public record Page<T>(List<T> items, boolean last) {
        /** A page is the last one when the tracker returned fewer raw entries than requested. */
        public static <T> Page<T> of(List<T> items, int rawSize, int pageSize) {
            return new Page<>(items, rawSize < pageSize);
        }
    }

    @FunctionalInterface
    public interface PageFetcher<T> {
        /** @param page zero-based page index */
        Page<T> fetch(int page) throws RemoteFailureException;
    }

    private final PageFetcher<T> fetcher;
    private final @Nullable Integer limit;
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private int nextPage;
    private int returned;
    private boolean exhausted;

    public PagedIterator(PageFetcher<T> fetcher, @Nullable Integer limit) {
        this.fetcher = fetcher;
        this.limit = limit;
    }

    /** Fetches one element per "page", for trackers addressed by a known list of ids. */
    public static <T> PagedIterator<T> ofSingles(
            List<String> ids, SingleFetcher<T> fetcher, @Nullable Integer limit) {
        return new PagedIterator<>(index -> {
            if (index >= ids.size()) {
                return new Page<>(List.of(), true);
            }
            T item = fetcher.fetch(ids.get(index));
            return new Page<>(item == null ? List.of() : List.of(item), index == ids.size() - 1);
        }, limit);
    }

    @FunctionalInterface
    public interface SingleFetcher<T> {
        /** @return the item, or null to skip this id */
        @Nullable T fetch(String id) throws RemoteFailureException;
    }

    @Override
    public boolean hasNext() {
        if (limit != null && returned >= limit) {
            return false;
        }
        while (buffer.isEmpty() && !exhausted) {
            Page<T> page;
            try {
                page = fetcher.fetch(nextPage++);
            } catch (RemoteFailureException e) {
                exhausted = true;
                throw new RemoteFailureException.Unchecked(e);
            }
            exhausted = page.last();
            buffer.addAll(page.items());
        }
        return !buffer.isEmpty();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        returned++;
        return buffer.removeFirst();
    }
}
