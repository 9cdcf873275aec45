package com.qubular.spotify.paging;

import com.qubular.spotify.URIHelper;
import com.qubular.spotify.model.CursorPaging;
import com.qubular.spotify.model.Paging;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LinkExtractorsTest {
    private static final String TRACKS = "https://api.spotify.com/v1/me/tracks";

    @Test
    public void offsetFollowsNextLink() {
        Paging<String> page = new Paging<>(TRACKS + "?offset=0&limit=2", List.of("a", "b"), 2,
                TRACKS + "?offset=2&limit=2", 0, null, 5);

        PageLinks links = LinkExtractors.<String>offset().links(page);

        assertEquals(Optional.of(TRACKS + "?offset=2&limit=2"), links.getNext().map(URI::toString));
        assertTrue(links.getPrevious().isEmpty());
        assertEquals(Integer.valueOf(5), LinkExtractors.<String>offset().total(page));
    }

    @Test
    public void offsetStopsAtTotalEvenWithNextLink() {
        Paging<String> page = new Paging<>(TRACKS + "?offset=4&limit=2", List.of("e"), 2,
                TRACKS + "?offset=6&limit=2", 4, TRACKS + "?offset=2&limit=2", 5);

        PageLinks links = LinkExtractors.<String>offset().links(page);

        assertTrue(links.getNext().isEmpty());
        assertEquals(Optional.of(TRACKS + "?offset=2&limit=2"), links.getPrevious().map(URI::toString));
    }

    @Test
    public void offsetStopsOnEmptyPage() {
        Paging<String> page = new Paging<>(TRACKS, Collections.emptyList(), 2, TRACKS + "?offset=2&limit=2", 0, null, 10);
        assertTrue(LinkExtractors.<String>offset().links(page).getNext().isEmpty());
    }

    @Test
    public void cursorRebuildsHrefWithAfter() {
        String href = "https://api.spotify.com/v1/me/following?type=artist&limit=2";
        CursorPaging<String> page = new CursorPaging<>(href, List.of("a", "b"), 2, href + "&after=b",
                new CursorPaging.Cursors("b", null), 4);

        PageLinks links = LinkExtractors.<String>cursor().links(page);

        Map<String, String> params = URIHelper.getQueryParams(links.getNext().orElseThrow());
        assertEquals("artist", params.get("type"));
        assertEquals("2", params.get("limit"));
        assertEquals("b", params.get("after"));
        assertFalse(params.containsKey("before"));
        assertTrue(links.getPrevious().isEmpty());
    }

    @Test
    public void cursorWithBeforeOffersPrevious() {
        String href = "https://api.spotify.com/v1/me/player/recently-played?limit=2&after=100";
        CursorPaging<String> page = new CursorPaging<>(href, List.of("a"), 2, null,
                new CursorPaging.Cursors(null, "90"), null);

        PageLinks links = LinkExtractors.<String>cursor().links(page);

        assertTrue(links.getNext().isEmpty());
        Map<String, String> params = URIHelper.getQueryParams(links.getPrevious().orElseThrow());
        assertEquals("90", params.get("before"));
        assertFalse(params.containsKey("after"));
        assertNull(LinkExtractors.<String>cursor().total(page));
    }

    @Test
    public void cursorWithoutHrefHasNoLinks() {
        CursorPaging<String> page = new CursorPaging<>(null, List.of("a"), 2, "https://example.com/next",
                new CursorPaging.Cursors("a", null), null);
        PageLinks links = LinkExtractors.<String>cursor().links(page);
        assertTrue(links.getNext().isEmpty());
        assertTrue(links.getPrevious().isEmpty());
    }
}
