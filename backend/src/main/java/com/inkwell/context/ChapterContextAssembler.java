package com.inkwell.context;

import com.inkwell.common.exception.EntityNotFoundException;
import com.inkwell.context.tier.ChapterScope;
import com.inkwell.context.tier.ContextTierBuilder;
import com.inkwell.domain.entity.Chapter;
import com.inkwell.repository.ChapterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 章节上下文组装器
 *
 * 以章节的外键引用为线索，逐层生成候选条目：
 *   L1 必需     - 本章正文、大纲、前一章末尾
 *   L2 外键展开 - 角色、限定范围的关系、地点、故事弧
 *   L3 剧情感知 - 伏笔、上章钩子
 *   L4 世界规则 - 力量体系、社会规则
 *   L5 钉选     - 调用方传入
 * 合并后按优先级贪心装入预算。组装器本身无状态，可并发服务不同章节。
 */
@Service
public class ChapterContextAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ChapterContextAssembler.class);

    private final ChapterRepository chapterRepository;
    private final PreviousChapterResolver previousChapterResolver;
    private final List<ContextTierBuilder> tierBuilders;
    private final BudgetFitter budgetFitter;
    private final ContextBudget budget;

    public ChapterContextAssembler(ChapterRepository chapterRepository,
                                   PreviousChapterResolver previousChapterResolver,
                                   List<ContextTierBuilder> tierBuilders,
                                   BudgetFitter budgetFitter,
                                   ContextBudget budget) {
        this.chapterRepository = chapterRepository;
        this.previousChapterResolver = previousChapterResolver;
        List<ContextTierBuilder> ordered = new ArrayList<>(tierBuilders);
        ordered.sort(Comparator.comparing(ContextTierBuilder::tier));
        this.tierBuilders = Collections.unmodifiableList(ordered);
        this.budgetFitter = budgetFitter;
        this.budget = budget;
    }

    public BuiltContext build(Long chapterId) {
        return build(chapterId, Collections.emptyList());
    }

    /**
     * @param chapterId 章节ID
     * @param pinnedItems 调用方钉选的条目（L5），可为空
     * @throws EntityNotFoundException 章节不存在
     */
    public BuiltContext build(Long chapterId, List<ContextItem> pinnedItems) {
        Chapter chapter = chapterId != null ? chapterRepository.selectById(chapterId) : null;
        if (chapter == null) {
            throw new EntityNotFoundException("Chapter", chapterId);
        }

        ChapterScope scope = ChapterScope.builder()
                .chapter(chapter)
                .previousChapter(previousChapterResolver.resolve(chapter))
                .pinnedItems(pinnedItems)
                .build();

        List<ContextItem> candidates = new ArrayList<>();
        for (ContextTierBuilder builder : tierBuilders) {
            candidates.addAll(builder.build(scope));
        }

        BuiltContext result = budgetFitter.fit(candidates, budget.getAvailableTokens());
        logger.info("📚 章节上下文组装完成: chapterId={}, 候选={}, 入选={}, tokens={}/{}, truncated={}",
                chapterId, candidates.size(), result.getItems().size(), result.getTotalTokens(),
                budget.getAvailableTokens(), result.isTruncated());
        return result;
    }
}
