package dev.newsdesk.adapter;

import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapParser;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;
import dev.newsdesk.fetch.FeedParseException;
import dev.newsdesk.fetch.Fetcher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Adapter for sources that expose their articles through {@code sitemap.xml}.
 *
 * <p>The sitemap at {@code settings.sitemapUrl} (default {@code <base>/sitemap.xml}) is parsed
 * with crawler-commons. A sitemap index is followed one level deep; a sub-sitemap that cannot be
 * read is skipped. Only same-site URLs are kept, newest {@code lastmod} first.
 */
@Component
public class SitemapArticleAdapter implements SourceAdapter {

    public static final String KEY = "sitemap";

    private static final Logger log = LoggerFactory.getLogger(SitemapArticleAdapter.class);

    private static final Comparator<SiteMapURL> NEWEST_FIRST = Comparator.comparing(
            SiteMapURL::getLastModified, Comparator.nullsLast(Comparator.<Date>reverseOrder()));

    private final Fetcher fetcher;
    private final ArticleExtractor extractor;

    public SitemapArticleAdapter(Fetcher fetcher, ArticleExtractor extractor) {
        this.fetcher = fetcher;
        this.extractor = extractor;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public List<String> listCandidates(CrawlTarget target, @Nullable Integer limit) {
        String sitemapUrl = Optional.ofNullable(target.setting("sitemapUrl"))
                .orElse(CandidateUrls.baseOf(target.baseUrl()) + "/sitemap.xml");

        Optional<AbstractSiteMap> root = fetchSitemap(sitemapUrl);
        if (root.isEmpty()) {
            log.warn("No sitemap for source '{}' at {}", target.name(), sitemapUrl);
            return List.of();
        }

        List<SiteMapURL> entries = new ArrayList<>();
        if (root.get() instanceof SiteMapIndex index) {
            for (AbstractSiteMap child : index.getSitemaps()) {
                entries.addAll(childEntries(child.getUrl().toString()));
            }
        } else if (root.get() instanceof SiteMap siteMap) {
            entries.addAll(siteMap.getSiteMapUrls());
        }

        Set<String> candidates = new LinkedHashSet<>();
        entries.stream()
                .sorted(NEWEST_FIRST)
                .map(entry -> CandidateUrls.canonicalize(entry.getUrl().toString()))
                .filter(url -> url != null && CandidateUrls.isSameSite(target.baseUrl(), url))
                .forEach(candidates::add);

        List<String> result = new ArrayList<>(candidates);
        if (limit != null && result.size() > limit) {
            return List.copyOf(result.subList(0, limit));
        }
        return List.copyOf(result);
    }

    @Override
    public Optional<ItemData> parseItem(CrawlTarget target, String identifier) {
        int minBodyLength = target.intSetting("minBodyLength", ArticleExtractor.DEFAULT_MIN_BODY_LENGTH);
        return fetcher.fetchText(identifier)
                .flatMap(html -> extractor.extract(html, identifier, minBodyLength));
    }

    private List<SiteMapURL> childEntries(String sitemapUrl) {
        try {
            Optional<AbstractSiteMap> child = fetchSitemap(sitemapUrl);
            if (child.isPresent() && child.get() instanceof SiteMap siteMap) {
                return new ArrayList<>(siteMap.getSiteMapUrls());
            }
        } catch (RuntimeException e) {
            log.warn("Skipping unreadable sub-sitemap {}: {}", sitemapUrl, e.getMessage());
        }
        return List.of();
    }

    /**
     * @return the parsed sitemap, or empty on 404
     * @throws FeedParseException when the document is not a sitemap
     */
    private Optional<AbstractSiteMap> fetchSitemap(String sitemapUrl) {
        Optional<byte[]> content = fetcher.fetchBytes(sitemapUrl, fetcher.defaultMaxRetries());
        if (content.isEmpty() || content.get().length == 0) {
            return Optional.empty();
        }
        try {
            URL url = URI.create(sitemapUrl).toURL();
            return Optional.of(new SiteMapParser(false).parseSiteMap(content.get(), url));
        } catch (UnknownFormatException | IOException | IllegalArgumentException e) {
            throw new FeedParseException(sitemapUrl, e);
        }
    }
}
