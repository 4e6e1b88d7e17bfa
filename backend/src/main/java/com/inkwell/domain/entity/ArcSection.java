package com.inkwell.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 故事弧中的一节
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArcSection {

    private String name;

    private List<Long> chapters;

    private String type;

    private String status;
}
