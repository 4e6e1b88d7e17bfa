package com.inkwell.context.tier;

import com.inkwell.context.ContextBudget;
import com.inkwell.context.ContextItem;
import com.inkwell.context.ContextTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * L5 钉选层：调用方传入的条目。未给优先级的补 L5 默认值，显式给出的保持不变。
 * 缺少 type 或 content 的条目直接丢弃。
 */
@Component
@Order(5)
public class PinnedTierBuilder implements ContextTierBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PinnedTierBuilder.class);

    private final ContextBudget budget;

    public PinnedTierBuilder(ContextBudget budget) {
        this.budget = budget;
    }

    @Override
    public ContextTier tier() {
        return ContextTier.L5_PINNED;
    }

    @Override
    public List<ContextItem> build(ChapterScope scope) {
        List<ContextItem> pinned = scope.getPinnedItems();
        if (pinned == null || pinned.isEmpty()) {
            return Collections.emptyList();
        }

        int defaultPriority = budget.priorityOf(tier());
        List<ContextItem> items = new ArrayList<>(pinned.size());
        for (ContextItem item : pinned) {
            if (item == null || item.getType() == null || item.getContent() == null) {
                logger.debug("忽略无效钉选条目: {}", item);
                continue;
            }
            items.add(item.getPriority() != null ? item : item.toBuilder().priority(defaultPriority).build());
        }
        return items;
    }
}
