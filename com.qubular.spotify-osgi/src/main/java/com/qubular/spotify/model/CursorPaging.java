package com.qubular.spotify.model;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Cursor based page of a collection, such as followed artists.
 */
public class CursorPaging<T> {
    private String href;
    private List<T> items;
    private int limit;
    private String next;
    private Cursors cursors;
    private Integer total;

    /** For Gson */
    CursorPaging() {
    }

    public CursorPaging(String href, List<T> items, int limit, String next, Cursors cursors, Integer total) {
        this.href = href;
        this.items = items;
        this.limit = limit;
        this.next = next;
        this.cursors = cursors;
        this.total = total;
    }

    public Optional<URI> getHref() {
        return Optional.ofNullable(href).map(URI::create);
    }

    public List<T> getItems() {
        return items == null ? Collections.emptyList() : items;
    }

    public int getLimit() {
        return limit;
    }

    public Optional<URI> getNext() {
        return Optional.ofNullable(next).map(URI::create);
    }

    public Optional<Cursors> getCursors() {
        return Optional.ofNullable(cursors);
    }

    public Integer getTotal() {
        return total;
    }

    public static class Cursors {
        private String after;
        private String before;

        /** For Gson */
        Cursors() {
        }

        public Cursors(String after, String before) {
            this.after = after;
            this.before = before;
        }

        public Optional<String> getAfter() {
            return Optional.ofNullable(after);
        }

        public Optional<String> getBefore() {
            return Optional.ofNullable(before);
        }
    }
}
