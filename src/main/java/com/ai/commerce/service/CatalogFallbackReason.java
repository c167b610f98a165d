package com.ai.commerce.service;

public enum CatalogFallbackReason {
    LARGE_CATALOG_VAGUE_QUERY("Large catalog with vague query after clarification"),
    SEE_ALL_REQUESTED("User requested to see all items"),
    LOW_CONFIDENCE_RESULTS("Low confidence search results"),
    VISUAL_SELECTION_REQUIRED("Products require visual selection"),
    REPEATED_SHORTLIST_REJECTIONS("User rejected multiple shortlists");

    private final String description;

    CatalogFallbackReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
