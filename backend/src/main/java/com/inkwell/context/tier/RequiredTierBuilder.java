package com.inkwell.context.tier;

import com.inkwell.context.ContextBudget;
import com.inkwell.context.ContextItem;
import com.inkwell.context.ContextItemType;
import com.inkwell.context.ContextTextRenderer;
import com.inkwell.context.ContextTier;
import com.inkwell.domain.entity.Chapter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * L1 必需层：本章正文、本章大纲、前一章末尾
 */
@Component
@Order(1)
public class RequiredTierBuilder implements ContextTierBuilder {

    private final ContextBudget budget;

    public RequiredTierBuilder(ContextBudget budget) {
        this.budget = budget;
    }

    @Override
    public ContextTier tier() {
        return ContextTier.L1_REQUIRED;
    }

    @Override
    public List<ContextItem> build(ChapterScope scope) {
        int priority = budget.priorityOf(tier());
        Chapter chapter = scope.getChapter();
        List<ContextItem> items = new ArrayList<>();

        if (StringUtils.isNotEmpty(chapter.getContent())) {
            items.add(ContextItem.builder()
                    .type(ContextItemType.CHAPTER_CONTENT)
                    .id(String.valueOf(chapter.getId()))
                    .content(chapter.getContent())
                    .priority(priority)
                    .build());
        }

        String outline = ContextTextRenderer.renderOutline(chapter.getOutline());
        if (outline != null) {
            items.add(ContextItem.builder()
                    .type(ContextItemType.CHAPTER_OUTLINE)
                    .id(String.valueOf(chapter.getId()))
                    .content(outline)
                    .priority(priority)
                    .build());
        }

        Chapter previous = scope.getPreviousChapter();
        if (previous != null && StringUtils.isNotEmpty(previous.getContent())) {
            items.add(ContextItem.builder()
                    .type(ContextItemType.CHAPTER_PREV_TAIL)
                    .id("prev-" + previous.getId())
                    .content(ContextTextRenderer.tail(previous.getContent(), budget.getPrevChapterTailLength()))
                    .priority(priority)
                    .build());
        }

        return items;
    }
}
