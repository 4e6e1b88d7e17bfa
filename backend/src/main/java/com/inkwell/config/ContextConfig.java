package com.inkwell.config;

import com.inkwell.context.ContextBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 上下文组装的预算与层级权重配置
 */
@Configuration
public class ContextConfig {

    private static final Logger logger = LoggerFactory.getLogger(ContextConfig.class);

    @Value("${inkwell.context.total-budget:1000000}")
    private int totalBudget;

    @Value("${inkwell.context.output-reserve:4000}")
    private int outputReserve;

    @Value("${inkwell.context.prompt-reserve:2000}")
    private int promptReserve;

    @Value("${inkwell.context.prev-chapter-tail-length:500}")
    private int prevChapterTailLength;

    @Value("${inkwell.context.priority.required:1000}")
    private int requiredPriority;

    @Value("${inkwell.context.priority.fk-expansion:800}")
    private int fkExpansionPriority;

    @Value("${inkwell.context.priority.plot-awareness:600}")
    private int plotAwarenessPriority;

    @Value("${inkwell.context.priority.world-rules:400}")
    private int worldRulesPriority;

    @Value("${inkwell.context.priority.pinned:200}")
    private int pinnedPriority;

    @Bean
    public ContextBudget contextBudget() {
        ContextBudget budget = ContextBudget.builder()
                .totalTokenBudget(totalBudget)
                .outputReserve(outputReserve)
                .promptReserve(promptReserve)
                .prevChapterTailLength(prevChapterTailLength)
                .requiredPriority(requiredPriority)
                .fkExpansionPriority(fkExpansionPriority)
                .plotAwarenessPriority(plotAwarenessPriority)
                .worldRulesPriority(worldRulesPriority)
                .pinnedPriority(pinnedPriority)
                .build();
        validate(budget);
        logger.info("上下文预算: 总量={}, 输出预留={}, 提示词预留={}, 可用={}",
                totalBudget, outputReserve, promptReserve, budget.getAvailableTokens());
        return budget;
    }

    static void validate(ContextBudget budget) {
        if (budget.getOutputReserve() < 0 || budget.getPromptReserve() < 0) {
            throw new IllegalStateException("上下文预留不能为负数");
        }
        if (budget.getAvailableTokens() < 0) {
            throw new IllegalStateException("上下文预留超过总预算: total=" + budget.getTotalTokenBudget()
                    + ", output=" + budget.getOutputReserve() + ", prompt=" + budget.getPromptReserve());
        }
        if (budget.getPrevChapterTailLength() < 0) {
            throw new IllegalStateException("前一章末尾长度不能为负数");
        }
    }
}
