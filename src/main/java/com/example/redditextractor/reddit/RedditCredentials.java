package com.example.redditextractor.reddit;

/**
 * Reddit app credentials. Without a client id and secret the public JSON endpoints are used.
 */
public record RedditCredentials(
        String clientId,
        String clientSecret,
        String userAgent
) {
    public static final String DEFAULT_USER_AGENT = "java:com.example.redditextractor:v1.0 (by /u/reddit-extractor)";

    public RedditCredentials {
        userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public boolean hasClientCredentials() {
        return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
    }

    @Override
    public String toString() {
        return "RedditCredentials[clientId=" + clientId + ", userAgent=" + userAgent + "]";
    }
}
