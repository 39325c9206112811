package com.example.redditextractor;

import com.example.redditextractor.model.Cursor;
import com.example.redditextractor.model.TimeWindow;

/**
 * Enumeration of one window could not continue. The window stays resumable from {@link #lastCursor()}.
 */
public class WindowFetchException extends Exception {
    private final TimeWindow window;
    private final Cursor lastCursor;

    public WindowFetchException(TimeWindow window, Cursor lastCursor, String message, Throwable cause) {
        super(message, cause);
        this.window = window;
        this.lastCursor = lastCursor;
    }

    public TimeWindow window() {
        return window;
    }

    public Cursor lastCursor() {
        return lastCursor;
    }
}
