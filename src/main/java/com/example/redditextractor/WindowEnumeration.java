package com.example.redditextractor;

import com.example.redditextractor.model.Cursor;
import com.example.redditextractor.model.SearchItem;
import com.example.redditextractor.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pull-based walk over one window. Pages are fetched on demand; {@link #cursor()} always points at the
 * oldest post handed out so far, so everything newer than it has been seen by the caller.
 */
public final class WindowEnumeration {
    private static final Logger LOGGER = LoggerFactory.getLogger(WindowEnumeration.class);
    private static final Comparator<SearchItem> NEWEST_FIRST =
            Comparator.comparing(SearchItem::created).reversed();

    private final RemoteSearchClient client;
    private final String subreddit;
    private final String query;
    private final TimeWindow window;
    private final int pageCap;
    private final int maxItems;
    private final Deque<SearchItem> pending = new ArrayDeque<>();

    private Instant bound;
    private Cursor cursor;
    private boolean chainDone;
    private boolean capReached;
    private int itemsChecked;
    private int calls;

    WindowEnumeration(RemoteSearchClient client,
                      String subreddit,
                      String query,
                      TimeWindow window,
                      Cursor resumeCursor,
                      int pageCap,
                      int maxItems) {
        this.client = client;
        this.subreddit = subreddit;
        this.query = query;
        this.window = window;
        this.pageCap = pageCap;
        this.maxItems = maxItems;
        this.cursor = resumeCursor;
        Instant newest = window.newestBound();
        this.bound = resumeCursor == null || resumeCursor.timestamp().isAfter(newest)
                ? newest
                : resumeCursor.timestamp();
    }

    /**
     * Fetches further pages as needed.
     *
     * @throws WindowFetchException if a call keeps failing or returns something unexpected
     * @throws SearchException      only for non-retryable failures, which end the whole job
     */
    public boolean hasNext() throws WindowFetchException, SearchException, InterruptedException {
        while (pending.isEmpty() && !chainDone) {
            fetchNextPage();
        }
        return !pending.isEmpty();
    }

    public SearchItem next() {
        SearchItem item = pending.pollFirst();
        if (item == null) {
            throw new NoSuchElementException("Window " + window + " has no buffered items");
        }
        cursor = Cursor.older(cursor, Cursor.of(item));
        return item;
    }

    private void fetchNextPage() throws WindowFetchException, SearchException, InterruptedException {
        if (itemsChecked >= maxItems) {
            LOGGER.warn("Window {} reached the safety limit of {} checked items; ending enumeration.", window, maxItems);
            capReached = true;
            chainDone = true;
            return;
        }
        List<SearchItem> page;
        try {
            page = client.fetchPage(subreddit, query, bound);
        } catch (SearchException ex) {
            if (ex.kind() == SearchException.Kind.NON_RETRYABLE) {
                throw ex;
            }
            throw new WindowFetchException(window, cursor,
                    "Window " + window + " failed at bound " + bound + ": " + ex.getMessage(), ex);
        }
        calls++;
        itemsChecked += page.size();
        if (page.isEmpty()) {
            chainDone = true;
            return;
        }

        Instant oldest = page.get(0).created();
        for (SearchItem item : page) {
            if (item.created().isBefore(oldest)) {
                oldest = item.created();
            }
            if (window.contains(item.created()) && !item.created().isAfter(bound)) {
                pending.addLast(item);
            }
        }
        // Hand items out strictly newest first so the cursor never skips an unseen newer item.
        List<SearchItem> sorted = pending.stream().sorted(NEWEST_FIRST).toList();
        pending.clear();
        pending.addAll(sorted);

        LOGGER.debug("Window {} call {}: {} items, {} in window, oldest {}", window, calls, page.size(), sorted.size(), oldest);
        if (RemoteSearchClient.chainExhausted(page.size(), pageCap, oldest, window.start())) {
            chainDone = true;
        } else {
            bound = RemoteSearchClient.nextBound(bound, oldest);
        }
    }

    public Cursor cursor() {
        return cursor;
    }

    public TimeWindow window() {
        return window;
    }

    public boolean capReached() {
        return capReached;
    }

    public int itemsChecked() {
        return itemsChecked;
    }

    public int calls() {
        return calls;
    }
}
