package com.example.redditextractor;

import com.example.redditextractor.model.Cursor;
import com.example.redditextractor.model.SearchItem;
import com.example.redditextractor.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.example.redditextractor.FakeSubredditSearch.item;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RemoteSearchClientTest {
    private static final Instant JAN = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant FEB = Instant.parse("2024-02-01T00:00:00Z");
    private static final TimeWindow WINDOW = new TimeWindow(0, JAN, FEB);

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final List<Duration> retryWaits = new ArrayList<>();

    private RemoteSearchClient client(FakeSubredditSearch search, int maxRetries, int maxItems) {
        RateLimitHandler handler = new RateLimitHandler(Duration.ofMillis(1), Duration.ofMillis(20), 0, maxRetries, sleeper);
        RemoteSearchClient client = new RemoteSearchClient(search, handler, 5, maxItems);
        client.retry().getEventPublisher().onRetry(event -> retryWaits.add(event.getWaitInterval()));
        return client;
    }

    private static List<SearchItem> hourly(String prefix, Instant newest, int count) {
        List<SearchItem> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(item(prefix + i, newest.minus(Duration.ofHours(i))));
        }
        return items;
    }

    private static List<String> drain(WindowEnumeration enumeration) throws Exception {
        List<String> ids = new ArrayList<>();
        while (enumeration.hasNext()) {
            ids.add(enumeration.next().id());
        }
        return ids;
    }

    @Test
    void chainEndsOnShortOrEmptyPagesOrOnceItPassesTheWindowStart() {
        assertTrue(RemoteSearchClient.chainExhausted(0, 1000, JAN, JAN));
        assertTrue(RemoteSearchClient.chainExhausted(999, 1000, FEB, JAN));
        assertTrue(RemoteSearchClient.chainExhausted(1000, 1000, JAN.minusSeconds(1), JAN));
        assertFalse(RemoteSearchClient.chainExhausted(1000, 1000, JAN, JAN));
        assertFalse(RemoteSearchClient.chainExhausted(1000, 1000, FEB, JAN));
    }

    @Test
    void nextBoundMovesToOldestOrStepsBackOneSecond() {
        Instant bound = FEB.minusSeconds(1);

        assertEquals(JAN, RemoteSearchClient.nextBound(bound, JAN));
        assertEquals(bound.minusSeconds(1), RemoteSearchClient.nextBound(bound, bound));
    }

    @Test
    void fullPageChainsANewCallBoundedByItsOldestPost() throws Exception {
        FakeSubredditSearch search = new FakeSubredditSearch(5, hourly("a", Instant.parse("2024-01-20T12:00:00Z"), 8));

        WindowEnumeration enumeration = client(search, 3, 100).enumerateWindow("test", "*", WINDOW, null);
        List<String> ids = drain(enumeration);

        assertEquals(WINDOW.newestBound(), search.searchBounds.get(0));
        assertEquals(Instant.parse("2024-01-20T08:00:00Z"), search.searchBounds.get(1));
        assertEquals(2, enumeration.calls());
        assertEquals(8, new LinkedHashSet<>(ids).size());
        assertEquals(new Cursor(Instant.parse("2024-01-20T05:00:00Z"), "a7"), enumeration.cursor());
    }

    @Test
    void yieldsNewestFirstAndStopsAtTheWindowStart() throws Exception {
        List<SearchItem> corpus = new ArrayList<>();
        corpus.add(item("next", FEB));
        corpus.add(item("late", Instant.parse("2024-01-31T23:59:59Z")));
        corpus.add(item("mid", Instant.parse("2024-01-15T00:00:00Z")));
        corpus.add(item("first", JAN));
        corpus.add(item("old1", JAN.minusSeconds(1)));
        corpus.add(item("old2", JAN.minusSeconds(3600)));
        FakeSubredditSearch search = new FakeSubredditSearch(5, corpus);

        WindowEnumeration enumeration = client(search, 3, 100).enumerateWindow("test", "*", WINDOW, null);

        assertEquals(List.of("late", "mid", "first"), drain(enumeration));
        assertEquals(1, enumeration.calls());
    }

    @Test
    void resumeCursorBecomesTheFirstBound() throws Exception {
        Instant cursorTime = Instant.parse("2024-01-20T09:00:00Z");
        FakeSubredditSearch search = new FakeSubredditSearch(5, hourly("a", Instant.parse("2024-01-20T12:00:00Z"), 8));

        WindowEnumeration enumeration = client(search, 3, 100)
                .enumerateWindow("test", "*", WINDOW, new Cursor(cursorTime, "a3"));
        List<String> ids = drain(enumeration);

        assertEquals(cursorTime, search.searchBounds.get(0));
        assertEquals(List.of("a3", "a4", "a5", "a6", "a7"), List.copyOf(new LinkedHashSet<>(ids)));
    }

    @Test
    void cursorOutsideTheWindowFallsBackToItsNewestBound() throws Exception {
        FakeSubredditSearch search = new FakeSubredditSearch(5, List.of());

        drain(client(search, 3, 100).enumerateWindow("test", "*", WINDOW, new Cursor(FEB.plusSeconds(60), "x")));

        assertEquals(WINDOW.newestBound(), search.searchBounds.get(0));
    }

    @Test
    void rateLimitedCallIsRetriedWithTheSameBound() throws Exception {
        FakeSubredditSearch search = new FakeSubredditSearch(5, hourly("a", Instant.parse("2024-01-20T12:00:00Z"), 3))
                .failNext(SearchException.rateLimited("slow down", Duration.ofMillis(15)));

        List<String> ids = drain(client(search, 3, 100).enumerateWindow("test", "*", WINDOW, null));

        assertEquals(3, ids.size());
        assertEquals(2, search.searchBounds.size());
        assertEquals(search.searchBounds.get(0), search.searchBounds.get(1));
        assertEquals(List.of(Duration.ofMillis(15)), retryWaits);
    }

    @Test
    void exhaustedTransientRetriesEscalateToWindowFailure() {
        SearchException boom = new SearchException(SearchException.Kind.TRANSIENT, "HTTP 503");
        FakeSubredditSearch search = new FakeSubredditSearch(5, List.of()).failAfter(0, boom);

        WindowEnumeration enumeration = client(search, 2, 100).enumerateWindow("test", "*", WINDOW, null);
        WindowFetchException ex = assertThrows(WindowFetchException.class, enumeration::hasNext);

        assertSame(boom, ex.getCause());
        assertSame(WINDOW, ex.window());
        assertNull(ex.lastCursor());
        assertEquals(3, search.searchBounds.size());
        assertEquals(List.of(Duration.ofMillis(1), Duration.ofMillis(2)), retryWaits);
    }

    @Test
    void malformedResponseFailsTheWindowWithoutRetrying() {
        FakeSubredditSearch search = new FakeSubredditSearch(5, List.of())
                .failNext(new SearchException(SearchException.Kind.MALFORMED, "no children"));

        WindowEnumeration enumeration = client(search, 3, 100).enumerateWindow("test", "*", WINDOW, null);

        assertThrows(WindowFetchException.class, enumeration::hasNext);
        assertEquals(1, search.searchBounds.size());
        assertTrue(retryWaits.isEmpty());
    }

    @Test
    void nonRetryableFailurePropagatesUnchanged() {
        FakeSubredditSearch search = new FakeSubredditSearch(5, List.of())
                .failNext(new SearchException(SearchException.Kind.NON_RETRYABLE, "HTTP 403"));

        WindowEnumeration enumeration = client(search, 3, 100).enumerateWindow("test", "*", WINDOW, null);
        SearchException ex = assertThrows(SearchException.class, enumeration::hasNext);

        assertEquals(SearchException.Kind.NON_RETRYABLE, ex.kind());
        assertEquals(1, search.searchBounds.size());
        assertTrue(retryWaits.isEmpty());
    }

    @Test
    void safetyLimitEndsAnOverfullWindow() throws Exception {
        FakeSubredditSearch search = new FakeSubredditSearch(5, hourly("a", Instant.parse("2024-01-30T00:00:00Z"), 40));

        WindowEnumeration enumeration = client(search, 3, 10).enumerateWindow("test", "*", WINDOW, null);
        Set<String> ids = new LinkedHashSet<>(drain(enumeration));

        assertTrue(enumeration.capReached());
        assertEquals(2, enumeration.calls());
        assertEquals(10, enumeration.itemsChecked());
        assertTrue(ids.size() < 40);
    }

    @Test
    void terminatesWhenAFullPageSharesOneSecond() throws Exception {
        Instant same = Instant.parse("2024-01-10T10:00:00Z");
        List<SearchItem> corpus = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            corpus.add(item("s" + i, same));
        }
        FakeSubredditSearch search = new FakeSubredditSearch(5, corpus);

        WindowEnumeration enumeration = client(search, 3, 100).enumerateWindow("test", "*", WINDOW, null);
        drain(enumeration);

        assertEquals(List.of(WINDOW.newestBound(), same, same.minusSeconds(1)), search.searchBounds);
        assertEquals(3, enumeration.calls());
    }

    @Test
    void retryAfterHintLongerThanMaxDelayIsCapped() throws Exception {
        FakeSubredditSearch search = new FakeSubredditSearch(5, List.of())
                .failNext(SearchException.rateLimited("slow down", Duration.ofSeconds(30)),
                        new SearchException(SearchException.Kind.TRANSIENT, "HTTP 502"));

        List<String> ids = drain(client(search, 3, 100).enumerateWindow("test", "*", WINDOW, null));

        assertTrue(ids.isEmpty());
        assertEquals(List.of(Duration.ofMillis(20), Duration.ofMillis(2)), retryWaits);
        assertEquals(3, search.searchBounds.size());
    }

    @Test
    void politenessDelayAppliesToEveryAttempt() throws Exception {
        RateLimitHandler handler = new RateLimitHandler(Duration.ofMillis(1), Duration.ofMillis(20), 1, 3, sleeper);
        FakeSubredditSearch search = new FakeSubredditSearch(5, List.of())
                .failNext(new SearchException(SearchException.Kind.TRANSIENT, "HTTP 503"));

        drain(new RemoteSearchClient(search, handler, 5, 100).enumerateWindow("test", "*", WINDOW, null));

        assertEquals(2, handler.requestCount());
        assertEquals(2, sleeper.sleeps.size());
    }
}
