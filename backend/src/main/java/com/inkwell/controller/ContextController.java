package com.inkwell.controller;

import com.inkwell.common.Result;
import com.inkwell.config.GlobalExceptionHandler.BusinessException;
import com.inkwell.context.BuiltContext;
import com.inkwell.context.ChapterContextAssembler;
import com.inkwell.context.ContextFormatter;
import com.inkwell.context.ContextItem;
import com.inkwell.context.GlobalContextAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 生成上下文接口
 */
@RestController
@RequestMapping("/context")
@CrossOrigin(originPatterns = {"http://localhost:*", "http://127.0.0.1:*"}, allowCredentials = "true")
public class ContextController {

    private static final Logger logger = LoggerFactory.getLogger(ContextController.class);

    private final ChapterContextAssembler chapterContextAssembler;
    private final GlobalContextAssembler globalContextAssembler;
    private final ContextFormatter contextFormatter;

    public ContextController(ChapterContextAssembler chapterContextAssembler,
                             GlobalContextAssembler globalContextAssembler,
                             ContextFormatter contextFormatter) {
        this.chapterContextAssembler = chapterContextAssembler;
        this.globalContextAssembler = globalContextAssembler;
        this.contextFormatter = contextFormatter;
    }

    /**
     * 组装章节上下文，请求体为可选的钉选条目
     */
    @PostMapping("/chapters/{chapterId}")
    public Result<BuiltContext> buildChapterContext(@PathVariable Long chapterId,
                                                    @RequestBody(required = false) List<ContextItem> pinnedItems) {
        logger.info("组装章节上下文: chapterId={}, 钉选={}", chapterId, pinnedItems == null ? 0 : pinnedItems.size());
        return Result.success(chapterContextAssembler.build(chapterId, pinnedItems));
    }

    @PostMapping("/chapters/{chapterId}/formatted")
    public Result<String> buildFormattedChapterContext(@PathVariable Long chapterId,
                                                       @RequestBody(required = false) List<ContextItem> pinnedItems) {
        BuiltContext context = chapterContextAssembler.build(chapterId, pinnedItems);
        return Result.success(contextFormatter.formatContext(context.getItems()));
    }

    @PostMapping("/format")
    public Result<String> format(@RequestBody(required = false) List<ContextItem> items) {
        return Result.success(contextFormatter.formatContext(items));
    }

    /**
     * 全书上下文：mode=full 汇总全部设定，mode=summary 只给名字和状态
     */
    @GetMapping("/global")
    public Result<BuiltContext> buildGlobalContext(@RequestParam(value = "mode", defaultValue = "full") String mode) {
        if ("full".equalsIgnoreCase(mode)) {
            return Result.success(globalContextAssembler.buildFull());
        }
        if ("summary".equalsIgnoreCase(mode)) {
            return Result.success(globalContextAssembler.buildSummary());
        }
        throw new BusinessException("不支持的模式: " + mode, "INVALID_MODE");
    }
}
