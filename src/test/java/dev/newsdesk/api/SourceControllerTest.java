package dev.newsdesk.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.newsdesk.config.GlobalExceptionHandler;
import dev.newsdesk.fixture.SourceBuilder;
import dev.newsdesk.source.DuplicateSourceException;
import dev.newsdesk.source.SourceDefinition;
import dev.newsdesk.source.SourceNotFoundException;
import dev.newsdesk.source.SourceService;
import dev.newsdesk.source.SourceUpdate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SourceControllerTest {

    @Mock
    private SourceService sourceService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SourceController(sourceService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void listsAllSourcesByDefault() throws Exception {
        when(sourceService.listAll()).thenReturn(List.of(
                new SourceBuilder().name("daily").build(),
                new SourceBuilder().name("wire").active(false).build()));

        mockMvc.perform(get("/api/sources"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].name").value("wire"))
                .andExpect(jsonPath("$[1].active").value(false));
        verify(sourceService, never()).listActive();
    }

    @Test
    void activeOnlyListsActiveSources() throws Exception {
        when(sourceService.listActive())
                .thenReturn(List.of(new SourceBuilder().name("daily").build()));

        mockMvc.perform(get("/api/sources").param("activeOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("daily"));
    }

    @Test
    void unknownSourceIsNotFound() throws Exception {
        when(sourceService.getByName("ghost")).thenThrow(new SourceNotFoundException("ghost"));

        mockMvc.perform(get("/api/sources/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Source not found: ghost"));
    }

    @Test
    void createReturnsCreatedSource() throws Exception {
        when(sourceService.create(any(SourceDefinition.class))).thenReturn(new SourceBuilder()
                .name("wire").baseUrl("https://wire.example.com").intervalMinutes(30)
                .setting("adapter", "rss").build());

        mockMvc.perform(post("/api/sources")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "wire", "baseUrl": "https://wire.example.com",
                                 "crawlIntervalMinutes": 30, "settings": {"adapter": "rss"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("wire"))
                .andExpect(jsonPath("$.crawlIntervalMinutes").value(30))
                .andExpect(jsonPath("$.settings.adapter").value("rss"));
        verify(sourceService).create(argThat(definition -> definition != null
                && definition.name().equals("wire")
                && definition.active() == null
                && "rss".equals(definition.settings().get("adapter"))));
    }

    @Test
    void createRejectsNonPositiveInterval() throws Exception {
        mockMvc.perform(post("/api/sources")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "wire", "baseUrl": "https://wire.example.com",
                                 "crawlIntervalMinutes": 0}
                                """))
                .andExpect(status().isBadRequest());
        verify(sourceService, never()).create(any());
    }

    @Test
    void duplicateNameConflicts() throws Exception {
        when(sourceService.create(any(SourceDefinition.class)))
                .thenThrow(new DuplicateSourceException("wire"));

        mockMvc.perform(post("/api/sources")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "wire", "baseUrl": "https://wire.example.com",
                                 "crawlIntervalMinutes": 15}
                                """))
                .andExpect(status().isConflict());
    }

    @Test
    void updateAppliesPartialChanges() throws Exception {
        when(sourceService.update(eq("wire"), any(SourceUpdate.class)))
                .thenReturn(new SourceBuilder().name("wire").active(false).build());

        mockMvc.perform(put("/api/sources/wire")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));
        verify(sourceService).update(eq("wire"), argThat(update -> update != null
                && Boolean.FALSE.equals(update.active())
                && update.baseUrl() == null
                && update.crawlIntervalMinutes() == null));
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/sources/wire"))
                .andExpect(status().isNoContent());
        verify(sourceService).delete("wire");
    }

    @Test
    void deletingUnknownSourceIsNotFound() throws Exception {
        doThrow(new SourceNotFoundException("ghost")).when(sourceService).delete("ghost");

        mockMvc.perform(delete("/api/sources/ghost"))
                .andExpect(status().isNotFound());
    }
}
