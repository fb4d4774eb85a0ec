package dev.newsdesk.adapter;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CandidateUrlsTest {

    @Test
    void canonicalizeRemovesFragmentAndTrackingParams() {
        String result = CandidateUrls.canonicalize(
                "https://News.Example.com/markets/rally?utm_source=rss&id=7&utm_medium=feed#comments");

        assertThat(result).isEqualTo("https://news.example.com/markets/rally?id=7");
    }

    @Test
    void canonicalizeDropsQueryMadeOnlyOfTrackingParams() {
        assertThat(CandidateUrls.canonicalize("https://news.example.com/a?fbclid=xyz&ref=home"))
                .isEqualTo("https://news.example.com/a");
    }

    @Test
    void canonicalizeSortsRemainingParams() {
        assertThat(CandidateUrls.canonicalize("https://news.example.com/a?b=2&a=1"))
                .isEqualTo("https://news.example.com/a?a=1&b=2");
    }

    @Test
    void canonicalizeDropsDefaultPortKeepsOthers() {
        assertThat(CandidateUrls.canonicalize("https://news.example.com:443/a"))
                .isEqualTo("https://news.example.com/a");
        assertThat(CandidateUrls.canonicalize("http://news.example.com:8080/a"))
                .isEqualTo("http://news.example.com:8080/a");
    }

    @Test
    void canonicalizeRejectsNonHttpAndRelativeUrls() {
        assertThat(CandidateUrls.canonicalize("mailto:desk@example.com")).isNull();
        assertThat(CandidateUrls.canonicalize("/relative/path")).isNull();
        assertThat(CandidateUrls.canonicalize("   ")).isNull();
        assertThat(CandidateUrls.canonicalize(null)).isNull();
    }

    @Test
    void resolveHandlesRelativeLinks() {
        assertThat(CandidateUrls.resolve("https://news.example.com/feed.xml", "/story/1"))
                .isEqualTo("https://news.example.com/story/1");
        assertThat(CandidateUrls.resolve("https://news.example.com/feed.xml",
                "https://other.example.org/x")).isEqualTo("https://other.example.org/x");
        assertThat(CandidateUrls.resolve("https://news.example.com/feed.xml", null)).isNull();
    }

    @Test
    void sameSiteIgnoresWwwAndCase() {
        assertThat(CandidateUrls.isSameSite("https://www.example.com",
                "https://EXAMPLE.com/news/1")).isTrue();
        assertThat(CandidateUrls.isSameSite("https://example.com", "https://cdn.example.com/x"))
                .isFalse();
        assertThat(CandidateUrls.isSameSite("https://example.com", "not a url")).isFalse();
    }

    @Test
    void baseOfStripsPath() {
        assertThat(CandidateUrls.baseOf("https://News.example.com/section/latest?x=1"))
                .isEqualTo("https://news.example.com");
    }
}
