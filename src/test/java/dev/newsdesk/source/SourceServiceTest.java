package dev.newsdesk.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.newsdesk.fixture.SourceBuilder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SourceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private SourceRepository sourceRepository;

    private SourceService sourceService;

    @BeforeEach
    void setUp() {
        sourceService = new SourceService(sourceRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createDefaultsToActive() {
        when(sourceRepository.existsByName("wire")).thenReturn(false);
        when(sourceRepository.save(any(Source.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        Source created = sourceService.create(new SourceDefinition("wire",
                "https://wire.example.com", null, 30, Map.of("adapter", "rss")));

        assertThat(created.isActive()).isTrue();
        assertThat(created.getCrawlIntervalMinutes()).isEqualTo(30);
        assertThat(created.getSettings()).containsEntry("adapter", "rss");
        assertThat(created.getLastCrawlAt()).isNull();
    }

    @Test
    void duplicateNameIsRejected() {
        when(sourceRepository.existsByName("wire")).thenReturn(true);

        assertThatThrownBy(() -> sourceService.create(new SourceDefinition("wire",
                "https://wire.example.com", true, 30, null)))
                .isInstanceOf(DuplicateSourceException.class);
        verify(sourceRepository, never()).save(any());
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        when(sourceRepository.existsByName("wire")).thenReturn(false);

        assertThatThrownBy(() -> sourceService.create(new SourceDefinition("wire",
                "https://wire.example.com", true, 0, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void updateLeavesNullFieldsAlone() {
        Source existing = new SourceBuilder().name("wire").baseUrl("https://wire.example.com")
                .intervalMinutes(15).setting("feedUrl", "https://wire.example.com/rss").build();
        when(sourceRepository.findByName("wire")).thenReturn(Optional.of(existing));
        when(sourceRepository.save(existing)).thenReturn(existing);

        Source updated = sourceService.update("wire", new SourceUpdate(null, false, 60, null));

        assertThat(updated.isActive()).isFalse();
        assertThat(updated.getCrawlIntervalMinutes()).isEqualTo(60);
        assertThat(updated.getBaseUrl()).isEqualTo("https://wire.example.com");
        assertThat(updated.getSettings()).containsEntry("feedUrl", "https://wire.example.com/rss");
    }

    @Test
    void unknownSourceIsReported() {
        when(sourceRepository.findByName("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> sourceService.getByName("ghost"))
                .isInstanceOf(SourceNotFoundException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void scheduledCrawlMovesBothMarkers() {
        Source source = new SourceBuilder().name("wire").build();
        when(sourceRepository.findByName("wire")).thenReturn(Optional.of(source));

        Optional<Instant> marked = sourceService.markCrawled("wire", true);

        assertThat(marked).contains(NOW);
        assertThat(source.getLastCrawlAt()).isEqualTo(NOW);
        assertThat(source.getLastScheduledCrawlAt()).isEqualTo(NOW);
        verify(sourceRepository).save(source);
    }

    @Test
    void manualCrawlMovesOnlyLastCrawl() {
        Instant scheduledBefore = NOW.minus(Duration.ofMinutes(7));
        Source source = new SourceBuilder().name("wire")
                .lastScheduledCrawlAt(scheduledBefore).build();
        when(sourceRepository.findByName("wire")).thenReturn(Optional.of(source));

        sourceService.markCrawled("wire", false);

        assertThat(source.getLastCrawlAt()).isEqualTo(NOW);
        assertThat(source.getLastScheduledCrawlAt()).isEqualTo(scheduledBefore);
    }

    @Test
    void deletedSourceIsIgnoredWhenMarking() {
        when(sourceRepository.findByName("gone")).thenReturn(Optional.empty());

        assertThat(sourceService.markCrawled("gone", true)).isEmpty();
        verify(sourceRepository, never()).save(any());
    }
}
