package com.ai.commerce.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class CatalogSearchResult {

    private List<CatalogItem> items = new ArrayList<>();

    private int totalMatchesEstimate;

    public static CatalogSearchResult empty() {
        return new CatalogSearchResult(new ArrayList<>(), 0);
    }
}
