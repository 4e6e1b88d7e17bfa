package com.inkwell.context.tier;

import com.inkwell.context.ContextBudget;
import com.inkwell.context.ContextItem;
import com.inkwell.context.ContextItemType;
import com.inkwell.domain.entity.Chapter;
import com.inkwell.domain.entity.Foreshadowing;
import com.inkwell.domain.entity.Hook;
import com.inkwell.repository.ForeshadowingRepository;
import com.inkwell.repository.HookRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlotAwarenessTierBuilderTest {

    @Mock
    private ForeshadowingRepository foreshadowingRepository;
    @Mock
    private HookRepository hookRepository;

    private PlotAwarenessTierBuilder builder;
    private Chapter chapter;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        builder = new PlotAwarenessTierBuilder(foreshadowingRepository, hookRepository, ContextBudget.builder().build());
        chapter = new Chapter();
        chapter.setId(12L);
    }

    @Test
    void shouldLabelHintedAndActiveForeshadowingWithoutDuplicates() {
        chapter.setForeshadowingHinted(Collections.singletonList("FS001"));
        Foreshadowing ring = foreshadowing("FS001", "the ring");
        Foreshadowing letter = foreshadowing("FS002", "the letter");
        when(foreshadowingRepository.selectBatchIds(Collections.singletonList("FS001")))
                .thenReturn(Collections.singletonList(ring));
        when(foreshadowingRepository.findActive()).thenReturn(Arrays.asList(ring, letter));

        List<ContextItem> items = builder.build(ChapterScope.builder().chapter(chapter).build());

        assertEquals(2, items.size());
        assertEquals("FS001", items.get(0).getId());
        assertEquals("[伏笔提示] the ring (状态: active)", items.get(0).getContent());
        assertEquals("active-FS002", items.get(1).getId());
        assertEquals("[活跃伏笔] the letter (状态: active)", items.get(1).getContent());
        assertEquals(600, items.get(1).getPriority());
    }

    @Test
    void shouldRenderHooksOfPreviousChapter() {
        Chapter previous = new Chapter();
        previous.setId(11L);
        Hook strong = hook("H1", "a shadow at the window", 80);
        Hook plain = hook("H2", "the bell rang twice", null);
        when(hookRepository.findByChapterId(11L)).thenReturn(Arrays.asList(strong, plain));

        List<ContextItem> items = builder.build(ChapterScope.builder().chapter(chapter).previousChapter(previous).build());

        assertEquals(2, items.size());
        assertEquals(ContextItemType.HOOK, items.get(0).getType());
        assertEquals("[上章钩子] a shadow at the window (强度: 80)", items.get(0).getContent());
        assertEquals("[上章钩子] the bell rang twice (强度: 未设定)", items.get(1).getContent());
    }

    @Test
    void shouldNotQueryHooksWithoutPreviousChapter() {
        assertTrue(builder.build(ChapterScope.builder().chapter(chapter).build()).isEmpty());

        verify(hookRepository, never()).findByChapterId(any());
        verify(foreshadowingRepository, never()).selectBatchIds(any());
    }

    private static Foreshadowing foreshadowing(String id, String content) {
        Foreshadowing foreshadowing = new Foreshadowing();
        foreshadowing.setId(id);
        foreshadowing.setContent(content);
        foreshadowing.setStatus("active");
        return foreshadowing;
    }

    private static Hook hook(String id, String content, Integer strength) {
        Hook hook = new Hook();
        hook.setId(id);
        hook.setContent(content);
        hook.setStrength(strength);
        return hook;
    }
}
