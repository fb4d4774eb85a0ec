package dev.newsdesk.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ContentHasherTest {

  @Test
  void hashOfKnownInputMatchesExpected() {
    String result = ContentHasher.sha256("hello");

    assertThat(result)
        .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
  }

  @Test
  void identifierHashIgnoresSurroundingWhitespace() {
    String url = "https://news.example.com/markets/rally";

    assertThat(ContentHasher.forIdentifier("  " + url + "\n"))
        .isEqualTo(ContentHasher.forIdentifier(url))
        .isEqualTo(ContentHasher.sha256(url));
  }

  @Test
  void distinctIdentifiersProduceDistinctHashes() {
    assertThat(ContentHasher.forIdentifier("https://news.example.com/a"))
        .isNotEqualTo(ContentHasher.forIdentifier("https://news.example.com/b"));
  }

  @Test
  void hashIsSixtyFourLowercaseHexCharacters() {
    assertThat(ContentHasher.forIdentifier("https://news.example.com/a")).matches("[0-9a-f]{64}");
  }
}
