package dev.newsdesk.fetch;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.Optional;
import java.util.function.Supplier;

import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Single-resource retrieval with per-attempt timeout, bounded retries and a fixed delay.
 *
 * <p>A 404 is a definitive answer: it yields {@link Optional#empty()} and is never retried.
 * Every other failure (timeout, connection error, any other non-2xx status) is treated as
 * transient and retried up to {@code maxAttempts} times before the last {@link FetchException}
 * is propagated. Nothing is cached.
 */
@Component
public class Fetcher {

    private static final Logger log = LoggerFactory.getLogger(Fetcher.class);

    private final RestClient restClient;
    private final FetchProperties properties;

    public Fetcher(@Qualifier("fetchRestClient") RestClient restClient, FetchProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    public int defaultMaxRetries() {
        return properties.maxRetries();
    }

    /**
     * Fetch a document as text using the configured attempt count.
     *
     * @param url absolute address of the document
     * @return the body, or empty if the server answered 404
     * @throws FetchException when every attempt failed transiently
     */
    public Optional<String> fetchText(String url) {
        return fetchText(url, properties.maxRetries());
    }

    /**
     * Fetch a document as text.
     *
     * @param url absolute address of the document
     * @param maxAttempts total attempts for transient failures (values below 1 mean 1)
     * @return the body, or empty if the server answered 404
     * @throws FetchException when every attempt failed transiently
     */
    public Optional<String> fetchText(String url, int maxAttempts) {
        return withRetry(url, maxAttempts, () -> get(url, String.class));
    }

    /**
     * Fetch a document as raw bytes, for XML formats that carry their own encoding declaration.
     *
     * @param url absolute address of the document
     * @param maxAttempts total attempts for transient failures
     * @return the body, or empty if the server answered 404
     * @throws FetchException when every attempt failed transiently
     */
    public Optional<byte[]> fetchBytes(String url, int maxAttempts) {
        return withRetry(url, maxAttempts, () -> get(url, byte[].class));
    }

    /**
     * Fetch and parse an RSS or Atom feed. Shares the retry policy of {@link #fetchText}; parsing
     * happens once, after the transport succeeded.
     *
     * @param url absolute address of the feed
     * @param maxAttempts total attempts for transient failures
     * @return the parsed feed, or empty if the server answered 404
     * @throws FetchException when every attempt failed transiently
     * @throws FeedParseException when the document is not a readable feed
     */
    public Optional<SyndFeed> fetchFeed(String url, int maxAttempts) {
        return fetchBytes(url, maxAttempts).map(bytes -> parseFeed(url, bytes));
    }

    private <T> Optional<T> withRetry(String url, int maxAttempts, Supplier<Optional<T>> attempt) {
        int attempts = Math.max(1, maxAttempts);
        return retryTemplate(attempts).execute(context -> {
            if (context.getRetryCount() > 0) {
                log.debug("Retrying {} (attempt {}/{}) after: {}", url, context.getRetryCount() + 1,
                        attempts, context.getLastThrowable() != null
                                ? context.getLastThrowable().getMessage() : "unknown error");
            }
            return attempt.get();
        });
    }

    private RetryTemplate retryTemplate(int attempts) {
        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(attempts)
                .retryOn(FetchException.class);
        if (properties.retryDelayMs() > 0) {
            builder.fixedBackoff(properties.retryDelayMs());
        } else {
            builder.noBackoff();
        }
        return builder.build();
    }

    private <T> Optional<T> get(String url, Class<T> type) {
        try {
            T body = restClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .body(type);
            return Optional.ofNullable(body);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Not found: {}", url);
            return Optional.empty();
        } catch (RestClientException e) {
            throw new FetchException(url, e);
        }
    }

    private SyndFeed parseFeed(String url, byte[] bytes) {
        try {
            return new SyndFeedInput().build(new XmlReader(new ByteArrayInputStream(bytes)));
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw new FeedParseException(url, e);
        }
    }
}
