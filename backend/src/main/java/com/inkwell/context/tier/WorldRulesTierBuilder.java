package com.inkwell.context.tier;

import com.inkwell.context.ContextBudget;
import com.inkwell.context.ContextItem;
import com.inkwell.context.ContextItemType;
import com.inkwell.context.ContextTextRenderer;
import com.inkwell.context.ContextTier;
import com.inkwell.domain.entity.PowerSystem;
import com.inkwell.domain.entity.World;
import com.inkwell.repository.WorldRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * L4 世界规则层：力量体系、社会规则
 */
@Component
@Order(4)
public class WorldRulesTierBuilder implements ContextTierBuilder {

    private final WorldRepository worldRepository;
    private final ContextBudget budget;

    public WorldRulesTierBuilder(WorldRepository worldRepository, ContextBudget budget) {
        this.worldRepository = worldRepository;
        this.budget = budget;
    }

    @Override
    public ContextTier tier() {
        return ContextTier.L4_WORLD_RULES;
    }

    @Override
    public List<ContextItem> build(ChapterScope scope) {
        List<ContextItem> items = new ArrayList<>();
        World world = worldRepository.findFirst();
        if (world == null) {
            return items;
        }
        int priority = budget.priorityOf(tier());

        // 没有核心规则时，只有等级或限制也不收录
        PowerSystem powerSystem = world.getPowerSystem();
        if (powerSystem != null && powerSystem.getCoreRules() != null && !powerSystem.getCoreRules().isEmpty()) {
            items.add(ContextItem.builder()
                    .type(ContextItemType.POWER_SYSTEM)
                    .id("power-system")
                    .content(ContextTextRenderer.renderPowerSystem(powerSystem))
                    .priority(priority)
                    .build());
        }

        if (world.getSocialRules() != null && !world.getSocialRules().isEmpty()) {
            items.add(ContextItem.builder()
                    .type(ContextItemType.SOCIAL_RULES)
                    .id("social-rules")
                    .content(ContextTextRenderer.renderSocialRules(world.getSocialRules()))
                    .priority(priority)
                    .build());
        }

        return items;
    }
}
