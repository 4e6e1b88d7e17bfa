package com.inkwell.context.tier;

import com.inkwell.context.ContextBudget;
import com.inkwell.context.ContextItem;
import com.inkwell.context.ContextItemType;
import com.inkwell.domain.entity.Chapter;
import com.inkwell.domain.entity.ChapterOutline;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequiredTierBuilderTest {

    private final RequiredTierBuilder builder = new RequiredTierBuilder(ContextBudget.builder().build());

    @Test
    void shouldOmitOutlineWhenAllPartsAreEmpty() {
        Chapter chapter = chapter(null);
        chapter.setOutline(new ChapterOutline("", Collections.emptyList(), null));

        assertTrue(builder.build(ChapterScope.builder().chapter(chapter).build()).isEmpty());
    }

    @Test
    void shouldRenderPartialOutline() {
        Chapter chapter = chapter("");
        chapter.setOutline(new ChapterOutline(null, null, "a knock at the door"));

        List<ContextItem> items = builder.build(ChapterScope.builder().chapter(chapter).build());

        assertEquals(1, items.size());
        assertEquals(ContextItemType.CHAPTER_OUTLINE, items.get(0).getType());
        assertEquals("钩子结尾: a knock at the door", items.get(0).getContent());
    }

    @Test
    void shouldKeepWhitespaceOnlyOutlineParts() {
        Chapter chapter = chapter(null);
        chapter.setOutline(new ChapterOutline(" ", null, "\t"));

        List<ContextItem> items = builder.build(ChapterScope.builder().chapter(chapter).build());

        assertEquals(1, items.size());
        assertEquals("目标:  \n钩子结尾: \t", items.get(0).getContent());
    }

    @Test
    void shouldUseWholePreviousContentWhenShorterThanTail() {
        Chapter previous = chapter("short ending");
        previous.setId(4L);

        List<ContextItem> items = builder.build(ChapterScope.builder().chapter(chapter(null)).previousChapter(previous).build());

        assertEquals(1, items.size());
        assertEquals("short ending", items.get(0).getContent());
        assertEquals(1000, items.get(0).getPriority());
    }

    @Test
    void shouldSkipTailWhenPreviousChapterHasNoContent() {
        Chapter previous = chapter("");
        previous.setId(4L);

        assertTrue(builder.build(ChapterScope.builder().chapter(chapter(null)).previousChapter(previous).build()).isEmpty());
    }

    @Test
    void shouldHonourConfiguredTailLength() {
        RequiredTierBuilder shortTail = new RequiredTierBuilder(ContextBudget.builder().prevChapterTailLength(3).build());
        Chapter previous = chapter("城门开了吗");
        previous.setId(4L);

        List<ContextItem> items = shortTail.build(ChapterScope.builder().chapter(chapter(null)).previousChapter(previous).build());

        assertEquals("开了吗", items.get(0).getContent());
    }

    private static Chapter chapter(String content) {
        Chapter chapter = new Chapter();
        chapter.setId(5L);
        chapter.setContent(content);
        return chapter;
    }
}
