package com.qubular.spotify.paging;

import com.qubular.spotify.URIHelper;
import com.qubular.spotify.model.CursorPaging;
import com.qubular.spotify.model.Paging;

import java.net.URI;
import java.util.function.Function;

public final class LinkExtractors {
    private LinkExtractors() {
    }

    /**
     * Follows the <code>next</code> and <code>previous</code> links of an offset page. An empty page, or one reaching
     * the reported total, is the last.
     */
    public static <I> LinkExtractor<Paging<I>> offset() {
        return offset(Function.identity());
    }

    public static <T> LinkExtractor<T> offset(Function<T, ? extends Paging<?>> envelope) {
        return new LinkExtractor<>() {
            @Override
            public PageLinks links(T page) {
                Paging<?> paging = envelope.apply(page);
                if (paging == null) {
                    return PageLinks.none();
                }
                URI previous = paging.getPrevious().orElse(null);
                if (paging.getItems().isEmpty() || paging.getOffset() + paging.getLimit() >= paging.getTotal()) {
                    return new PageLinks(null, previous);
                }
                return new PageLinks(paging.getNext().orElse(null), previous);
            }

            @Override
            public Integer total(T page) {
                Paging<?> paging = envelope.apply(page);
                return paging == null ? null : paging.getTotal();
            }
        };
    }

    public static <I> LinkExtractor<CursorPaging<I>> cursor() {
        return cursor(Function.identity());
    }

    /**
     * Rebuilds the page's <code>href</code> with its <code>after</code> or <code>before</code> cursor.
     */
    public static <T> LinkExtractor<T> cursor(Function<T, ? extends CursorPaging<?>> envelope) {
        return new LinkExtractor<>() {
            @Override
            public PageLinks links(T page) {
                CursorPaging<?> paging = envelope.apply(page);
                if (paging == null || paging.getHref().isEmpty()) {
                    return PageLinks.none();
                }
                URI href = paging.getHref().get();
                URI next = null;
                if (!paging.getItems().isEmpty() && paging.getNext().isPresent()) {
                    next = paging.getCursors()
                            .flatMap(CursorPaging.Cursors::getAfter)
                            .map(after -> URIHelper.withQueryParam(URIHelper.withoutQueryParam(href, "before"), "after", after))
                            .orElse(paging.getNext().get());
                }
                URI previous = paging.getCursors()
                        .flatMap(CursorPaging.Cursors::getBefore)
                        .map(before -> URIHelper.withQueryParam(URIHelper.withoutQueryParam(href, "after"), "before", before))
                        .orElse(null);
                return new PageLinks(next, previous);
            }

            @Override
            public Integer total(T page) {
                CursorPaging<?> paging = envelope.apply(page);
                return paging == null ? null : paging.getTotal();
            }
        };
    }
}
