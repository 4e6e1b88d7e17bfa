package com.inkwell.controller;

import com.inkwell.common.exception.EntityNotFoundException;
import com.inkwell.config.GlobalExceptionHandler;
import com.inkwell.context.BuiltContext;
import com.inkwell.context.ChapterContextAssembler;
import com.inkwell.context.ContextFormatter;
import com.inkwell.context.ContextItem;
import com.inkwell.context.ContextItemType;
import com.inkwell.context.GlobalContextAssembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ContextControllerTest {

    @Mock
    private ChapterContextAssembler chapterContextAssembler;
    @Mock
    private GlobalContextAssembler globalContextAssembler;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ContextController controller = new ContextController(chapterContextAssembler, globalContextAssembler,
                new ContextFormatter());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .defaultResponseCharacterEncoding(StandardCharsets.UTF_8)
                .build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldBuildChapterContextWithPinnedItems() throws Exception {
        ContextItem content = ContextItem.builder().type(ContextItemType.CHAPTER_CONTENT).id("11")
                .content("The gate creaked open.").priority(1000).build();
        when(chapterContextAssembler.build(eq(11L), anyList()))
                .thenReturn(new BuiltContext(Collections.singletonList(content), 6, false));

        mockMvc.perform(post("/context/chapters/11")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"type\":\"custom\",\"id\":\"note1\",\"content\":\"keep tone wistful\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.items[0].type").value("chapter_content"))
                .andExpect(jsonPath("$.data.totalTokens").value(6))
                .andExpect(jsonPath("$.data.truncated").value(false));

        ArgumentCaptor<List<ContextItem>> pinned = ArgumentCaptor.forClass(List.class);
        verify(chapterContextAssembler).build(eq(11L), pinned.capture());
        assertEquals(ContextItemType.CUSTOM, pinned.getValue().get(0).getType());
        assertNull(pinned.getValue().get(0).getPriority());
    }

    @Test
    void shouldMapMissingChapterToNotFound() throws Exception {
        when(chapterContextAssembler.build(eq(99L), any())).thenThrow(new EntityNotFoundException("Chapter", 99L));

        mockMvc.perform(post("/context/chapters/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.id").value("99"));
    }

    @Test
    void shouldFormatItems() throws Exception {
        mockMvc.perform(post("/context/format")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"type\":\"hook\",\"id\":\"H1\",\"content\":\"a knock\",\"priority\":600}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("<context>\n## 剧情线索\na knock\n</context>"));
    }

    @Test
    void shouldRejectUnknownItemType() throws Exception {
        mockMvc.perform(post("/context/format")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"type\":\"weather\",\"content\":\"rain\"}]"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRejectUnknownGlobalMode() throws Exception {
        mockMvc.perform(get("/context/global").param("mode", "everything"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_MODE"));
    }

    @Test
    void shouldServeGlobalSummary() throws Exception {
        when(globalContextAssembler.buildSummary()).thenReturn(new BuiltContext(Collections.emptyList(), 0, false));

        mockMvc.perform(get("/context/global").param("mode", "summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalTokens").value(0));
    }
}
