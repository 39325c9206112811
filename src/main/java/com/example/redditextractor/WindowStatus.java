package com.example.redditextractor;

public enum WindowStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETE
}
