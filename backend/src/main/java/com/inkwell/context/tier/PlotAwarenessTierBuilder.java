package com.inkwell.context.tier;

import com.inkwell.context.ContextBudget;
import com.inkwell.context.ContextItem;
import com.inkwell.context.ContextItemType;
import com.inkwell.context.ContextTextRenderer;
import com.inkwell.context.ContextTier;
import com.inkwell.context.EntityLookups;
import com.inkwell.domain.entity.Chapter;
import com.inkwell.domain.entity.Foreshadowing;
import com.inkwell.domain.entity.Hook;
import com.inkwell.repository.ForeshadowingRepository;
import com.inkwell.repository.HookRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * L3 剧情感知层：本章提示的伏笔、其余仍活跃的伏笔、上一章留下的钩子
 */
@Component
@Order(3)
public class PlotAwarenessTierBuilder implements ContextTierBuilder {

    private final ForeshadowingRepository foreshadowingRepository;
    private final HookRepository hookRepository;
    private final ContextBudget budget;

    public PlotAwarenessTierBuilder(ForeshadowingRepository foreshadowingRepository,
                                    HookRepository hookRepository,
                                    ContextBudget budget) {
        this.foreshadowingRepository = foreshadowingRepository;
        this.hookRepository = hookRepository;
        this.budget = budget;
    }

    @Override
    public ContextTier tier() {
        return ContextTier.L3_PLOT_AWARENESS;
    }

    @Override
    public List<ContextItem> build(ChapterScope scope) {
        int priority = budget.priorityOf(tier());
        Chapter chapter = scope.getChapter();
        List<ContextItem> items = new ArrayList<>();

        List<String> hintedIds = EntityLookups.distinctIds(chapter.getForeshadowingHinted());
        if (!hintedIds.isEmpty()) {
            List<Foreshadowing> hinted = EntityLookups.inRequestedOrder(hintedIds,
                    foreshadowingRepository.selectBatchIds(hintedIds), Foreshadowing::getId);
            for (Foreshadowing foreshadowing : hinted) {
                items.add(ContextItem.builder()
                        .type(ContextItemType.FORESHADOWING)
                        .id(foreshadowing.getId())
                        .content(ContextTextRenderer.renderHintedForeshadowing(foreshadowing))
                        .priority(priority)
                        .build());
            }
        }

        // 已在本章提示过的不再重复出现
        Set<String> hintedSet = new HashSet<>(hintedIds);
        for (Foreshadowing foreshadowing : foreshadowingRepository.findActive()) {
            if (!hintedSet.contains(foreshadowing.getId())) {
                items.add(ContextItem.builder()
                        .type(ContextItemType.FORESHADOWING)
                        .id("active-" + foreshadowing.getId())
                        .content(ContextTextRenderer.renderActiveForeshadowing(foreshadowing))
                        .priority(priority)
                        .build());
            }
        }

        Chapter previous = scope.getPreviousChapter();
        if (previous != null) {
            for (Hook hook : hookRepository.findByChapterId(previous.getId())) {
                items.add(ContextItem.builder()
                        .type(ContextItemType.HOOK)
                        .id(hook.getId())
                        .content(ContextTextRenderer.renderHook(hook))
                        .priority(priority)
                        .build());
            }
        }

        return items;
    }
}
