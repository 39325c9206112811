package com.example.redditextractor;

public enum JobStatus {
    NOT_STARTED,
    RUNNING,
    FINISHED,
    FAILED
}
