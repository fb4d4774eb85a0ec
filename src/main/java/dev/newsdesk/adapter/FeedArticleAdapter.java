package dev.newsdesk.adapter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import dev.newsdesk.fetch.Fetcher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Adapter for sources that publish an RSS or Atom feed.
 *
 * <p>Candidates are the entry links of the feed at {@code settings.feedUrl} (default: the base
 * address), canonicalized and optionally filtered by the {@code settings.urlPattern} regular
 * expression. Items are parsed from the linked article pages.
 */
@Component
public class FeedArticleAdapter implements SourceAdapter {

    public static final String KEY = "rss";

    private static final Logger log = LoggerFactory.getLogger(FeedArticleAdapter.class);

    private final Fetcher fetcher;
    private final ArticleExtractor extractor;

    public FeedArticleAdapter(Fetcher fetcher, ArticleExtractor extractor) {
        this.fetcher = fetcher;
        this.extractor = extractor;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public List<String> listCandidates(CrawlTarget target, @Nullable Integer limit) {
        String feedUrl = Optional.ofNullable(target.setting("feedUrl")).orElse(target.baseUrl());
        Optional<SyndFeed> feed = fetcher.fetchFeed(feedUrl, fetcher.defaultMaxRetries());
        if (feed.isEmpty()) {
            log.warn("Feed for source '{}' not found at {}", target.name(), feedUrl);
            return List.of();
        }

        Pattern urlPattern = urlPattern(target);
        Set<String> candidates = new LinkedHashSet<>();
        for (SyndEntry entry : feed.get().getEntries()) {
            if (limit != null && candidates.size() >= limit) {
                break;
            }
            String link = entryLink(entry);
            String url = CandidateUrls.canonicalize(CandidateUrls.resolve(feedUrl, link));
            if (url == null) {
                log.debug("Skipping feed entry without a usable link: {}", entry.getTitle());
                continue;
            }
            if (urlPattern != null && !urlPattern.matcher(url).find()) {
                continue;
            }
            candidates.add(url);
        }
        log.debug("Feed {} yielded {} candidates for '{}'", feedUrl, candidates.size(), target.name());
        return List.copyOf(candidates);
    }

    @Override
    public Optional<ItemData> parseItem(CrawlTarget target, String identifier) {
        int minBodyLength = target.intSetting("minBodyLength", ArticleExtractor.DEFAULT_MIN_BODY_LENGTH);
        return fetcher.fetchText(identifier)
                .flatMap(html -> extractor.extract(html, identifier, minBodyLength));
    }

    private static @Nullable String entryLink(SyndEntry entry) {
        if (entry.getLink() != null && !entry.getLink().isBlank()) {
            return entry.getLink();
        }
        return entry.getUri();
    }

    private static @Nullable Pattern urlPattern(CrawlTarget target) {
        String regex = target.setting("urlPattern");
        if (regex == null) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException(
                    "Invalid urlPattern for source '" + target.name() + "': " + regex, e);
        }
    }
}
