package com.qubular.spotify.paging;

/**
 * Reads the continuation links out of a decoded page.
 */
@FunctionalInterface
public interface LinkExtractor<T> {
    PageLinks links(T page);

    /**
     * @return the size of the whole collection as reported by the page, or null if it is not reported.
     */
    default Integer total(T page) {
        return null;
    }
}
