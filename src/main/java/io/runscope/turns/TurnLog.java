package io.runscope.turns;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnLog(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("model") String model,
        @JsonProperty("profile") String profile,
        @JsonProperty("turns") List<Turn> turns,
        @JsonProperty("pricing") PricingEstimate pricing,
        @JsonProperty("response_text") String responseText
) {
    public TurnLog {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public TurnLog withResponseText(String text) {
        return new TurnLog(sessionId, model, profile, turns, pricing, text);
    }

    public TurnLog withPricing(PricingEstimate estimate) {
        return new TurnLog(sessionId, model, profile, turns, estimate, responseText);
    }

    /** A user turn carries {@code text}; an assistant turn carries {@code steps}. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Turn(
            @JsonProperty("role") String role,
            @JsonProperty("text") String text,
            @JsonProperty("steps") List<Step> steps
    ) {
        public static Turn user(String text) {
            return new Turn("user", text, null);
        }

        public static Turn assistant(List<Step> steps) {
            return new Turn("assistant", null, List.copyOf(steps));
        }

        @JsonIgnore
        public boolean isUser() {
            return "user".equals(role);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Step(
            @JsonProperty("text") String text,
            @JsonProperty("tool_call") ToolCall toolCall
    ) {
    }

    public record ToolCall(
            @JsonProperty("call_id") String callId,
            @JsonProperty("tool_name") String toolName,
            @JsonProperty("arguments") Object arguments,
            @JsonProperty("output") String output,
            @JsonProperty("is_error") boolean isError
    ) {
    }
}
