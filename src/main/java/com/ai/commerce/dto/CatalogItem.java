package com.ai.commerce.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CatalogItem {

    private String id;

    private String name;

    private String category;

    private BigDecimal price;

    /** Search relevance in [0, 1]; null when the search backend does not score. */
    private Double score;

    @Builder.Default
    private List<Map<String, String>> variants = new ArrayList<>();
}
