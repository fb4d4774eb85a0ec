package dev.newsdesk.source;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Configuration boundary for {@link Source} records: list-active, get-by-name and marker updates
 * for the crawl engine, plus the create/update/delete operations behind the REST API.
 */
@Service
public class SourceService {

    private static final Logger log = LoggerFactory.getLogger(SourceService.class);

    private final SourceRepository sourceRepository;
    private final Clock clock;

    public SourceService(SourceRepository sourceRepository, Clock clock) {
        this.sourceRepository = sourceRepository;
        this.clock = clock;
    }

    public List<Source> listActive() {
        return sourceRepository.findAllByActiveTrueOrderByNameAsc();
    }

    public List<Source> listAll() {
        return sourceRepository.findAllByOrderByNameAsc();
    }

    public Optional<Source> findByName(String name) {
        return sourceRepository.findByName(name);
    }

    /**
     * @throws SourceNotFoundException if no source has this name
     */
    public Source getByName(String name) {
        return sourceRepository.findByName(name)
                .orElseThrow(() -> new SourceNotFoundException(name));
    }

    /**
     * Register a new source.
     *
     * @throws DuplicateSourceException if the name is taken
     * @throws IllegalArgumentException if the interval is not positive
     */
    @Transactional
    public Source create(SourceDefinition definition) {
        if (sourceRepository.existsByName(definition.name())) {
            throw new DuplicateSourceException(definition.name());
        }
        Source source = new Source(definition.name(), definition.baseUrl(),
                definition.crawlIntervalMinutes());
        source.setActive(definition.active() == null || definition.active());
        source.setSettings(definition.settings());
        Source saved = sourceRepository.save(source);
        log.info("Registered source '{}' ({}, every {} min)", saved.getName(), saved.getBaseUrl(),
                saved.getCrawlIntervalMinutes());
        return saved;
    }

    @Transactional
    public Source update(String name, SourceUpdate update) {
        Source source = getByName(name);
        if (update.baseUrl() != null && !update.baseUrl().isBlank()) {
            source.setBaseUrl(update.baseUrl());
        }
        if (update.active() != null) {
            source.setActive(update.active());
        }
        if (update.crawlIntervalMinutes() != null) {
            source.setCrawlIntervalMinutes(update.crawlIntervalMinutes());
        }
        if (update.settings() != null) {
            source.setSettings(update.settings());
        }
        return sourceRepository.save(source);
    }

    @Transactional
    public void delete(String name) {
        Source source = getByName(name);
        sourceRepository.delete(source);
        log.info("Deleted source '{}'", name);
    }

    /**
     * Advance {@code last_crawl} (and {@code last_scheduled_crawl} for scheduler-started runs) to
     * now. A source deleted while its crawl was running is ignored.
     *
     * @param name      the crawled source
     * @param scheduled whether the scheduler started the run
     * @return the instant recorded, or empty if the source no longer exists
     */
    @Transactional
    public Optional<Instant> markCrawled(String name, boolean scheduled) {
        Optional<Source> sourceOpt = sourceRepository.findByName(name);
        if (sourceOpt.isEmpty()) {
            log.warn("Source '{}' disappeared before its crawl markers could be updated", name);
            return Optional.empty();
        }
        Instant now = clock.instant();
        Source source = sourceOpt.get();
        source.recordCrawl(now, scheduled);
        sourceRepository.save(source);
        return Optional.of(now);
    }
}
