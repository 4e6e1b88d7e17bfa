package com.inkwell.context;

/**
 * 文本 token 估算函数，要求确定性，允许近似
 */
@FunctionalInterface
public interface TokenEstimator {

    int estimateTokens(String text);
}
