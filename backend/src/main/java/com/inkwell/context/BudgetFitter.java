package com.inkwell.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 按优先级贪心装箱。
 *
 * 稳定排序后逐条累加，放不下的条目直接跳过（不回溯、不截断单条内容），
 * 后面更小的条目仍有机会入选。
 */
@Component
public class BudgetFitter {

    private static final Logger logger = LoggerFactory.getLogger(BudgetFitter.class);

    private final TokenEstimator tokenEstimator;

    public BudgetFitter(TokenEstimator tokenEstimator) {
        this.tokenEstimator = tokenEstimator;
    }

    public BuiltContext fit(List<ContextItem> candidates, int budget) {
        List<ContextItem> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(ContextItem::priorityValue).reversed());

        List<ContextItem> selected = new ArrayList<>();
        int totalTokens = 0;
        boolean truncated = false;

        for (ContextItem item : sorted) {
            int itemTokens = tokenEstimator.estimateTokens(item.getContent());
            // 用剩余额度比较，避免大估值时 int 相加溢出
            if (itemTokens <= budget - totalTokens) {
                selected.add(item);
                totalTokens += itemTokens;
            } else {
                truncated = true;
                logger.debug("超出预算，丢弃条目: type={}, id={}, tokens={}, used={}/{}",
                        item.getType().getValue(), item.getId(), itemTokens, totalTokens, budget);
            }
        }

        return new BuiltContext(Collections.unmodifiableList(selected), totalTokens, truncated);
    }
}
