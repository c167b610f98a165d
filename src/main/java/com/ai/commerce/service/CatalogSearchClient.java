package com.ai.commerce.service;

import com.ai.commerce.dto.CatalogSearchResult;

/**
 * Product search owned by the catalog service.
 */
public interface CatalogSearchClient {

    CatalogSearchResult search(String tenantId, String query);
}
