package dev.newsdesk.api;

import java.util.List;

import dev.newsdesk.source.Source;
import dev.newsdesk.source.SourceDefinition;
import dev.newsdesk.source.SourceService;
import dev.newsdesk.source.SourceUpdate;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Source configuration CRUD.
 */
@RestController
@RequestMapping("/api/sources")
public class SourceController {

    private final SourceService sourceService;

    public SourceController(SourceService sourceService) {
        this.sourceService = sourceService;
    }

    @GetMapping
    public List<SourceView> list(@RequestParam(defaultValue = "false") boolean activeOnly) {
        List<Source> sources = activeOnly ? sourceService.listActive() : sourceService.listAll();
        return sources.stream().map(SourceView::from).toList();
    }

    @GetMapping("/{name}")
    public SourceView get(@PathVariable String name) {
        return SourceView.from(sourceService.getByName(name));
    }

    @PostMapping
    public ResponseEntity<SourceView> create(@Valid @RequestBody SourceDefinition definition) {
        Source created = sourceService.create(definition);
        return ResponseEntity.status(HttpStatus.CREATED).body(SourceView.from(created));
    }

    @PutMapping("/{name}")
    public SourceView update(@PathVariable String name, @Valid @RequestBody SourceUpdate update) {
        return SourceView.from(sourceService.update(name, update));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> delete(@PathVariable String name) {
        sourceService.delete(name);
        return ResponseEntity.noContent().build();
    }
}
