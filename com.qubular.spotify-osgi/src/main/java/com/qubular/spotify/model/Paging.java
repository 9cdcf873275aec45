package com.qubular.spotify.model;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Offset based page of a collection.
 */
public class Paging<T> {
    private String href;
    private List<T> items;
    private int limit;
    private String next;
    private int offset;
    private String previous;
    private int total;

    /** For Gson */
    Paging() {
    }

    public Paging(String href, List<T> items, int limit, String next, int offset, String previous, int total) {
        this.href = href;
        this.items = items;
        this.limit = limit;
        this.next = next;
        this.offset = offset;
        this.previous = previous;
        this.total = total;
    }

    public String getHref() {
        return href;
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

    public int getOffset() {
        return offset;
    }

    public Optional<URI> getPrevious() {
        return Optional.ofNullable(previous).map(URI::create);
    }

    public int getTotal() {
        return total;
    }
}
