package com.careerpath.orchestrator.provider.search;

import com.careerpath.orchestrator.provider.ProviderException;

import java.util.List;

/**
 * Web search provider. May return an empty list.
 */
public interface SearchService {

    /**
     * @throws ProviderException when the provider fails after retries
     */
    List<SearchResult> search(String query, int maxResults);
}
