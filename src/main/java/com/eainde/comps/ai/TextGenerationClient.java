package com.eainde.comps.ai;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * Black-box structured text generation.
 *
 * <p>Used identically by extraction (list-of-names schema) and classification
 * (scored-list schema). Implementations return parsed JSON; validating the JSON against
 * the caller's expectations is the caller's job.</p>
 */
public interface TextGenerationClient {

    /**
     * @param prompt full user prompt
     * @param schema expected response shape, passed to the model as a response format hint
     * @return the parsed JSON response
     * @throws TextGenerationException on timeout, rate limiting, unparseable output or service failure
     */
    JsonNode generate(String prompt, JsonSchema schema);
}
