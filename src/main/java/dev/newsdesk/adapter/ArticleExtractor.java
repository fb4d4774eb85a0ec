package dev.newsdesk.adapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Generic article extraction from HTML with jsoup.
 *
 * <p>Boilerplate (scripts, navigation, ads, share widgets, comment sections) is removed first.
 * The body is built from paragraph-like blocks longer than {@value #MIN_BLOCK_LENGTH}
 * characters, joined by blank lines. An article without a title or with a body shorter than the
 * requested minimum is reported as absent.
 */
@Component
public class ArticleExtractor {

    public static final int DEFAULT_MIN_BODY_LENGTH = 100;

    static final int MIN_BLOCK_LENGTH = 30;

    private static final String BOILERPLATE = String.join(", ",
            "script", "style", "noscript", "iframe", "nav", "aside", "footer", "header", "form",
            "button", ".ad", ".ads", ".advertisement", ".social", ".share", ".newsletter",
            ".related", ".comments");

    private static final String BLOCKS = "p, h2, h3, h4, li, blockquote";

    /**
     * @param html          the fetched document
     * @param url           where it was fetched from, used to resolve relative references
     * @param minBodyLength bodies shorter than this are rejected
     * @return the article, or empty when the page does not look like one
     */
    public Optional<ItemData> extract(String html, String url, int minBodyLength) {
        Document doc = Jsoup.parse(html, url);
        Map<String, Object> metadata = metadata(doc);

        String title = title(doc);
        if (title == null) {
            return Optional.empty();
        }

        doc.select(BOILERPLATE).remove();
        Element root = contentRoot(doc);
        String body = body(root);
        if (body.length() < minBodyLength) {
            return Optional.empty();
        }
        return Optional.of(new ItemData(title, body, metadata));
    }

    private @Nullable String title(Document doc) {
        String title = meta(doc, "og:title");
        if (title == null) {
            Element h1 = doc.selectFirst("h1");
            title = h1 != null ? normalize(h1.text()) : null;
        }
        if (title == null) {
            title = normalize(doc.title());
        }
        return title;
    }

    private Element contentRoot(Document doc) {
        Element article = doc.selectFirst("article");
        if (article != null) {
            return article;
        }
        Element main = doc.selectFirst("main");
        return main != null ? main : doc.body();
    }

    private String body(Element root) {
        List<String> blocks = new ArrayList<>();
        for (Element block : root.select(BLOCKS)) {
            // nested blocks (p inside li or blockquote) are covered by their parent
            if (block.parents().stream().anyMatch(parent -> parent.is(BLOCKS))) {
                continue;
            }
            String text = normalize(block.text());
            if (text != null && text.length() > MIN_BLOCK_LENGTH) {
                blocks.add(text);
            }
        }
        return String.join("\n\n", blocks);
    }

    private Map<String, Object> metadata(Document doc) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "author", firstOf(meta(doc, "author"), meta(doc, "article:author"),
                text(doc, "[rel=author], .author, .byline")));
        putIfPresent(metadata, "publishedAt", firstOf(meta(doc, "article:published_time"),
                attr(doc, "time[datetime]", "datetime")));
        putIfPresent(metadata, "category", meta(doc, "article:section"));
        putIfPresent(metadata, "siteName", meta(doc, "og:site_name"));
        putIfPresent(metadata, "description", firstOf(meta(doc, "og:description"),
                meta(doc, "description")));
        return metadata;
    }

    private @Nullable String meta(Document doc, String name) {
        Element element = doc.selectFirst(
                "meta[property=\"" + name + "\"], meta[name=\"" + name + "\"]");
        return element != null ? normalize(element.attr("content")) : null;
    }

    private @Nullable String text(Document doc, String selector) {
        Element element = doc.selectFirst(selector);
        return element != null ? normalize(element.text()) : null;
    }

    private @Nullable String attr(Document doc, String selector, String attribute) {
        Element element = doc.selectFirst(selector);
        return element != null ? normalize(element.attr(attribute)) : null;
    }

    private static @Nullable String firstOf(@Nullable String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key,
                                     @Nullable String value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }

    private static @Nullable String normalize(@Nullable String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.replaceAll("\\s+", " ").strip();
        return normalized.isEmpty() ? null : normalized;
    }
}
