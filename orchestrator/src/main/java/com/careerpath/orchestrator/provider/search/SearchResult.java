package com.careerpath.orchestrator.provider.search;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One web search hit. content is the provider's page excerpt; score and
 * publishedDate may be null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchResult(String title,
                           String url,
                           String content,
                           Double score,
                           @JsonAlias("published_date") String publishedDate) {}
