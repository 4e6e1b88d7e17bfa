package com.inkwell.domain.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 角色性格面
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CharacterFacets {

    /**
     * 公开面
     */
    @JsonProperty("public")
    private String publicFace;

    /**
     * 私下面
     */
    @JsonProperty("private")
    private String privateFace;

    private String hidden;

    /**
     * 压力下的表现
     */
    private String underPressure;
}
