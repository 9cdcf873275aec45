package com.qubular.spotify.paging;

import com.google.gson.reflect.TypeToken;
import com.qubular.spotify.ApiClient;
import com.qubular.spotify.ApiRequest;
import com.qubular.spotify.ApiResponse;
import com.qubular.spotify.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.net.URI;
import java.util.Optional;

/**
 * Walks a paginated collection forwards and backwards by following the links of each page.
 * <p>
 * The first {@link #next()} fetches the initial request. State only changes once a page has been fetched and
 * decoded, so a failed call can be retried. Instances are not thread safe.
 */
public class Pager<T> {
    private static final Logger logger = LoggerFactory.getLogger(Pager.class);

    private final ApiClient apiClient;
    private final ApiRequest request;
    private final Type pageType;
    private final LinkExtractor<T> linkExtractor;

    private PageLinks links;
    private URI currentLink;
    private int position = -1;
    private Integer total;

    public Pager(ApiClient apiClient, ApiRequest initial, TypeToken<T> pageType, LinkExtractor<T> linkExtractor) {
        this(apiClient, initial, pageType.getType(), linkExtractor);
    }

    public Pager(ApiClient apiClient, ApiRequest initial, Type pageType, LinkExtractor<T> linkExtractor) {
        this.apiClient = apiClient;
        this.request = initial;
        this.pageType = pageType;
        this.linkExtractor = linkExtractor;
        this.links = new PageLinks(initial.getTarget(), null);
    }

    /**
     * @return the next page, or empty at the end of the collection.
     */
    public Optional<T> next() throws AuthenticationException, IOException {
        Optional<URI> next = links.getNext();
        if (next.isEmpty()) {
            return Optional.empty();
        }
        return fetch(next.get(), 1);
    }

    /**
     * @return the previous page, or empty at the start of the collection.
     */
    public Optional<T> prev() throws AuthenticationException, IOException {
        Optional<URI> previous = links.getPrevious();
        if (position < 1 || previous.isEmpty()) {
            return Optional.empty();
        }
        return fetch(previous.get(), -1);
    }

    /**
     * Fetches the current page again, for instance after removing one of its items.
     *
     * @return the current page, or empty if no page has been fetched yet.
     */
    public Optional<T> current() throws AuthenticationException, IOException {
        if (currentLink == null) {
            return Optional.empty();
        }
        return fetch(currentLink, 0);
    }

    public boolean hasNext() {
        return links.getNext().isPresent();
    }

    public boolean hasPrevious() {
        return position >= 1 && links.getPrevious().isPresent();
    }

    /**
     * @return the index of the current page, -1 before the first page is fetched.
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the collection size reported by the last page, if any.
     */
    public Optional<Integer> getTotal() {
        return Optional.ofNullable(total);
    }

    private Optional<T> fetch(URI link, int step) throws AuthenticationException, IOException {
        logger.trace("Fetching page {} from {}", position + step, link);
        ApiResponse<T> response = apiClient.execute(request.withTarget(link), pageType);
        if (response.isNoContent() || response.getBody().isEmpty()) {
            logger.debug("No content at {}", link);
            return Optional.empty();
        }
        T page = response.getBody().get();
        PageLinks newLinks = linkExtractor.links(page);
        Integer newTotal = linkExtractor.total(page);

        links = newLinks;
        currentLink = link;
        position += step;
        if (newTotal != null) {
            total = newTotal;
        }
        logger.trace("At page {}, {}", position, links);
        return Optional.of(page);
    }
}
