package io.runscope.turns;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PricingEstimate(
        @JsonProperty("model_id") String modelId,
        @JsonProperty("estimated_input_tokens") long estimatedInputTokens,
        @JsonProperty("estimated_output_tokens") long estimatedOutputTokens,
        @JsonProperty("estimated_cost_usd") Double estimatedCostUsd,
        @JsonProperty("prompt_price_per_token") Double promptPricePerToken,
        @JsonProperty("completion_price_per_token") Double completionPricePerToken
) {
}
