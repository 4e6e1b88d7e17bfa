package com.inkwell.repository.handler;

import com.baomidou.mybatisplus.extension.handlers.AbstractJsonTypeHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inkwell.domain.entity.ArcSection;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedJdbcTypes;
import org.apache.ibatis.type.MappedTypes;

import java.util.List;

/**
 * arcs.sections 列的 JSON 映射。
 *
 * JacksonTypeHandler 只拿得到擦除后的 List，元素会被解析成 Map，这里显式带上元素类型。
 */
@MappedTypes(List.class)
@MappedJdbcTypes(JdbcType.VARCHAR)
public class ArcSectionListTypeHandler extends AbstractJsonTypeHandler<List<ArcSection>> {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<List<ArcSection>> SECTION_LIST = new TypeReference<List<ArcSection>>() {};

    @Override
    protected List<ArcSection> parse(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, SECTION_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("故事弧分节JSON解析失败: " + json, e);
        }
    }

    @Override
    protected String toJson(List<ArcSection> obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("故事弧分节JSON序列化失败", e);
        }
    }
}
