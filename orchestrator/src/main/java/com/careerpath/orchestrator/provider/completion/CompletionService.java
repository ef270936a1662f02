package com.careerpath.orchestrator.provider.completion;

import com.careerpath.orchestrator.provider.ProviderException;

/**
 * Text-generation provider. The reply is free-form text; callers run it
 * through the extractor and must not assume it is valid JSON.
 */
public interface CompletionService {

    /**
     * @throws ProviderException when the provider fails after retries
     */
    String complete(String systemPrompt, String userPrompt);
}
