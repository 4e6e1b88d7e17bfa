package com.inkwell.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 批量外键查询的辅助方法
 */
public final class EntityLookups {

    private EntityLookups() {
    }

    /**
     * 去掉空值和重复，保留首次出现的顺序
     */
    public static List<String> distinctIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null) {
                distinct.add(id);
            }
        }
        return new ArrayList<>(distinct);
    }

    /**
     * 批量查询的结果按请求的 id 顺序排列；查不到的 id 直接略过。
     */
    public static <T> List<T> inRequestedOrder(List<String> ids, Collection<T> found, Function<T, String> idOf) {
        if (found == null || found.isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, T> byId = new LinkedHashMap<>();
        for (T entity : found) {
            byId.put(idOf.apply(entity), entity);
        }
        List<T> ordered = new ArrayList<>(byId.size());
        for (String id : ids) {
            T entity = byId.get(id);
            if (entity != null) {
                ordered.add(entity);
            }
        }
        return ordered;
    }
}
