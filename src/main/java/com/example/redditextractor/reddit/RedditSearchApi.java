package com.example.redditextractor.reddit;

import com.example.redditextractor.SearchException;
import com.example.redditextractor.Sleeper;
import com.example.redditextractor.SubredditSearch;
import com.example.redditextractor.model.SearchItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * {@link SubredditSearch} over Reddit's JSON endpoints.
 *
 * <p>Search pages through {@code /r/<sub>/search.json} sorted by {@code new}, 100 posts per request, following
 * the {@code after} token until {@link SubredditSearch#PAGE_CAP} posts are collected or the listing ends.
 * The upper time bound is passed as a cloudsearch {@code timestamp:} range and also enforced on the results.
 *
 * <p>With client credentials an application-only OAuth token is requested and calls go to
 * {@code oauth.reddit.com}; otherwise the public endpoints are used. When {@code x-ratelimit-remaining} drops
 * below 2 the next request waits for {@code x-ratelimit-reset}.
 */
public final class RedditSearchApi implements SubredditSearch {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedditSearchApi.class);

    static final String PUBLIC_BASE = "https://www.reddit.com";
    static final String OAUTH_BASE = "https://oauth.reddit.com";
    static final String TOKEN_URL = "https://www.reddit.com/api/v1/access_token";
    private static final int LISTING_LIMIT = 100;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration TOKEN_MARGIN = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final RedditCredentials credentials;
    private final int commentDepth;
    private final Sleeper sleeper;
    private final String publicBase;
    private final String oauthBase;
    private final String tokenUrl;

    private String accessToken;
    private Instant tokenExpiry = Instant.EPOCH;

    public RedditSearchApi(RedditCredentials credentials, int commentDepth, Sleeper sleeper) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_2)
                        .connectTimeout(REQUEST_TIMEOUT)
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .build(),
                credentials, commentDepth, sleeper, PUBLIC_BASE, OAUTH_BASE, TOKEN_URL);
    }

    RedditSearchApi(HttpClient httpClient,
                    RedditCredentials credentials,
                    int commentDepth,
                    Sleeper sleeper,
                    String publicBase,
                    String oauthBase,
                    String tokenUrl) {
        this.httpClient = httpClient;
        this.credentials = credentials;
        this.commentDepth = commentDepth;
        this.sleeper = sleeper;
        this.publicBase = publicBase;
        this.oauthBase = oauthBase;
        this.tokenUrl = tokenUrl;
    }

    @Override
    public List<SearchItem> search(String subreddit, String query, Instant before) throws SearchException, InterruptedException {
        List<SearchItem> items = new ArrayList<>();
        String after = null;
        int requests = 0;
        do {
            String url = base() + "/r/" + encode(subreddit) + "/search.json?" + searchParameters(query, before, after);
            RedditJson.Listing listing = RedditJson.parseListing(getJson(url));
            requests++;
            for (SearchItem item : listing.items()) {
                if (before == null || !item.created().isAfter(before)) {
                    items.add(item);
                }
                if (items.size() >= PAGE_CAP) {
                    break;
                }
            }
            after = listing.items().isEmpty() && listing.skipped() == 0 ? null : listing.after();
        } while (after != null && items.size() < PAGE_CAP);
        LOGGER.debug("Search r/{} before {}: {} posts in {} requests", subreddit, before, items.size(), requests);
        return items;
    }

    @Override
    public String fetchComments(SearchItem item) throws SearchException, InterruptedException {
        String url = base() + "/comments/" + encode(item.id()) + ".json?limit=500&raw_json=1&depth=" + (commentDepth + 1);
        return RedditJson.flattenComments(getJson(url), commentDepth);
    }

    @Override
    public Optional<Instant> subredditCreated(String subreddit) throws SearchException, InterruptedException {
        return RedditJson.parseCreated(getJson(base() + "/r/" + encode(subreddit) + "/about.json?raw_json=1"));
    }

    static String searchParameters(String query, Instant before, String after) {
        StringBuilder params = new StringBuilder()
                .append("q=").append(encode(searchQuery(query, before)))
                .append("&restrict_sr=on&sort=new&raw_json=1&limit=").append(LISTING_LIMIT);
        if (before != null) {
            params.append("&syntax=cloudsearch");
        }
        if (after != null) {
            params.append("&after=").append(encode(after));
        }
        return params.toString();
    }

    /**
     * Combines the user query with an inclusive {@code timestamp:0..<before>} range in cloudsearch syntax.
     */
    static String searchQuery(String query, Instant before) {
        boolean matchAll = query == null || query.isBlank() || "*".equals(query.trim());
        if (before == null) {
            return matchAll ? "*" : query.trim();
        }
        String range = "timestamp:0.." + before.getEpochSecond();
        if (matchAll) {
            return range;
        }
        return "(and '" + query.trim().replace("'", "\\'") + "' " + range + ")";
    }

    /**
     * Maps a non-2xx status to the matching failure kind, or returns null for success.
     */
    static SearchException classify(int status, Optional<String> retryAfter, String url) {
        if (status >= 200 && status < 300) {
            return null;
        }
        if (status == 429) {
            return SearchException.rateLimited("HTTP 429 from " + url, parseSeconds(retryAfter.orElse(null)));
        }
        if (status == 408 || status >= 500) {
            return new SearchException(SearchException.Kind.TRANSIENT, "HTTP " + status + " from " + url);
        }
        String reason = switch (status) {
            case 401 -> "invalid or expired credentials";
            case 403 -> "access denied (private, quarantined or banned subreddit)";
            case 404 -> "not found";
            default -> status >= 300 && status < 400 ? "redirected (subreddit does not exist?)" : "rejected";
        };
        return new SearchException(SearchException.Kind.NON_RETRYABLE, "HTTP " + status + " " + reason + ": " + url);
    }

    private JsonNode getJson(String url) throws SearchException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("User-Agent", credentials.userAgent())
                .GET();
        String token = bearerToken();
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        HttpResponse<String> response = send(request.build());
        if (response.statusCode() == 401 && token != null) {
            accessToken = null;
        }
        return readBody(response, url);
    }

    private String bearerToken() throws SearchException, InterruptedException {
        if (!credentials.hasClientCredentials()) {
            return null;
        }
        if (accessToken != null && Instant.now().isBefore(tokenExpiry)) {
            return accessToken;
        }
        String basic = Base64.getEncoder().encodeToString(
                (credentials.clientId() + ":" + credentials.clientSecret()).getBytes(StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .timeout(REQUEST_TIMEOUT)
                .header("User-Agent", credentials.userAgent())
                .header("Authorization", "Basic " + basic)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString("grant_type=client_credentials"))
                .build();
        JsonNode body = readBody(send(request), tokenUrl);
        accessToken = RedditJson.parseAccessToken(body);
        long expiresIn = body.path("expires_in").asLong(3600);
        tokenExpiry = Instant.now().plusSeconds(expiresIn).minus(TOKEN_MARGIN);
        LOGGER.info("Obtained Reddit OAuth token (valid {}s)", expiresIn);
        return accessToken;
    }

    private HttpResponse<String> send(HttpRequest request) throws SearchException, InterruptedException {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            checkRateLimit(response);
            return response;
        } catch (IOException ex) {
            throw new SearchException(SearchException.Kind.TRANSIENT,
                    "Request to " + request.uri() + " failed: " + ex.getMessage(), ex);
        }
    }

    private JsonNode readBody(HttpResponse<String> response, String url) throws SearchException {
        SearchException failure = classify(response.statusCode(), response.headers().firstValue("retry-after"), url);
        if (failure != null) {
            throw failure;
        }
        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException ex) {
            throw new SearchException(SearchException.Kind.MALFORMED, "Unparseable JSON from " + url, ex);
        }
    }

    /**
     * Waits for the quota window to reset when fewer than two requests remain in it.
     */
    private void checkRateLimit(HttpResponse<?> response) throws InterruptedException {
        Optional<String> remaining = response.headers().firstValue("x-ratelimit-remaining");
        if (remaining.isEmpty()) {
            return;
        }
        try {
            if (Double.parseDouble(remaining.get()) >= 2.0) {
                return;
            }
        } catch (NumberFormatException ex) {
            LOGGER.debug("Malformed x-ratelimit-remaining header: {}", remaining.get());
            return;
        }
        Duration reset = parseSeconds(response.headers().firstValue("x-ratelimit-reset").orElse(null));
        if (reset != null) {
            Duration wait = reset.plusSeconds(1);
            LOGGER.warn("Reddit rate limit nearly exhausted. Sleeping for {}s", wait.toSeconds());
            sleeper.sleep(wait);
        }
    }

    static Duration parseSeconds(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.ofMillis((long) (Double.parseDouble(value.trim()) * 1000));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private String base() {
        return credentials.hasClientCredentials() ? oauthBase : publicBase;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
