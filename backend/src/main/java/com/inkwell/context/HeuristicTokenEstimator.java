package com.inkwell.context;

import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 估算文本token数（粗略估计：中文1字≈1.5token，其余按词≈1.3token）
 */
@Component
public class HeuristicTokenEstimator implements TokenEstimator {

    private static final Pattern CJK = Pattern.compile("[\\u4e00-\\u9fff\\u3400-\\u4dbf\\uf900-\\ufaff]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final double CJK_WEIGHT = 1.5;
    private static final double WORD_WEIGHT = 1.3;

    @Override
    public int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }

        int cjkCount = 0;
        Matcher matcher = CJK.matcher(text);
        while (matcher.find()) {
            cjkCount++;
        }

        // 汉字替换为空白后再数词
        String rest = CJK.matcher(text).replaceAll(" ");
        int wordCount = 0;
        for (String word : WHITESPACE.split(rest)) {
            if (!word.isEmpty()) {
                wordCount++;
            }
        }

        return (int) Math.ceil(cjkCount * CJK_WEIGHT + wordCount * WORD_WEIGHT);
    }
}
