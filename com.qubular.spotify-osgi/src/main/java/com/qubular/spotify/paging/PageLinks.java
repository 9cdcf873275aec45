package com.qubular.spotify.paging;

import java.net.URI;
import java.util.Optional;

/**
 * Links to the pages either side of a decoded page.
 */
public final class PageLinks {
    private static final PageLinks NONE = new PageLinks(null, null);

    private final URI next;
    private final URI previous;

    public PageLinks(URI next, URI previous) {
        this.next = next;
        this.previous = previous;
    }

    public static PageLinks none() {
        return NONE;
    }

    public Optional<URI> getNext() {
        return Optional.ofNullable(next);
    }

    public Optional<URI> getPrevious() {
        return Optional.ofNullable(previous);
    }

    @Override
    public String toString() {
        return "PageLinks{next=" + next + ", previous=" + previous + '}';
    }
}
