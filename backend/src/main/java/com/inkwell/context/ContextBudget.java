package com.inkwell.context;

import lombok.Builder;
import lombok.Value;

/**
 * 上下文配额控制（防止token溢出）
 *
 * 可用预算 = 总上限 - 输出预留 - 提示词预留。
 */
@Value
@Builder
public class ContextBudget {

    /**
     * 总token上限
     */
    @Builder.Default
    private Integer totalTokenBudget = 1_000_000;

    /**
     * 为模型输出预留
     */
    @Builder.Default
    private Integer outputReserve = 4_000;

    /**
     * 为提示词框架预留
     */
    @Builder.Default
    private Integer promptReserve = 2_000;

    /**
     * 前一章末尾截取的字符数
     */
    @Builder.Default
    private Integer prevChapterTailLength = 500;

    @Builder.Default
    private Integer requiredPriority = 1000;

    @Builder.Default
    private Integer fkExpansionPriority = 800;

    @Builder.Default
    private Integer plotAwarenessPriority = 600;

    @Builder.Default
    private Integer worldRulesPriority = 400;

    @Builder.Default
    private Integer pinnedPriority = 200;

    public int getAvailableTokens() {
        return totalTokenBudget - outputReserve - promptReserve;
    }

    public int priorityOf(ContextTier tier) {
        switch (tier) {
            case L1_REQUIRED:
                return requiredPriority;
            case L2_FK_EXPANSION:
                return fkExpansionPriority;
            case L3_PLOT_AWARENESS:
                return plotAwarenessPriority;
            case L4_WORLD_RULES:
                return worldRulesPriority;
            case L5_PINNED:
                return pinnedPriority;
            default:
                throw new IllegalArgumentException("未知的上下文层级: " + tier);
        }
    }
}
