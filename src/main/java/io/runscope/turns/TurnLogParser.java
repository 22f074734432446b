package io.runscope.turns;

import com.fasterxml.jackson.databind.JsonNode;
import io.runscope.util.Jsons;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds an agent session's {@code events.ndjson} into alternating user and assistant turns.
 * Tool calls are paired start-to-end by call id; an end without a start is dropped.
 */
public final class TurnLogParser {

    public TurnLog parse(String raw) {
        String sessionId = null;
        String model = null;
        String profile = null;
        List<TurnLog.Turn> turns = new ArrayList<>();
        List<TurnLog.Step> assistantSteps = new ArrayList<>();
        Map<String, PendingCall> pendingCalls = new HashMap<>();

        for (JsonNode event : events(raw)) {
            JsonNode data = event.path("data");
            switch (event.path("kind").asText("")) {
                case "SESSION_START" -> {
                    sessionId = Jsons.textField(event, "session_id");
                    model = text(data, "model");
                    profile = text(data, "profile");
                }
                case "USER_INPUT" -> {
                    flush(turns, assistantSteps);
                    turns.add(TurnLog.Turn.user(text(data, "text")));
                }
                case "TOOL_CALL_START" -> pendingCalls.put(
                        text(data, "call_id"),
                        new PendingCall(text(data, "tool_name"), parseArguments(data.get("arguments_json")))
                );
                case "TOOL_CALL_END" -> {
                    String callId = text(data, "call_id");
                    PendingCall pending = pendingCalls.remove(callId);
                    if (pending != null) {
                        String toolName = data.hasNonNull("tool_name") ? text(data, "tool_name") : pending.toolName();
                        assistantSteps.add(new TurnLog.Step(null, new TurnLog.ToolCall(
                                callId,
                                toolName,
                                pending.arguments(),
                                text(data, "full_output"),
                                data.path("is_error").asBoolean(false)
                        )));
                    }
                }
                case "ASSISTANT_TEXT_END" -> {
                    String text = text(data, "text");
                    if (!text.isEmpty()) {
                        assistantSteps.add(new TurnLog.Step(text, null));
                    }
                }
                default -> {
                }
            }
        }
        flush(turns, assistantSteps);
        return new TurnLog(
                sessionId,
                model == null || model.isEmpty() ? null : model,
                profile == null || profile.isEmpty() ? null : profile,
                turns,
                null,
                null
        );
    }

    private static List<JsonNode> events(String raw) {
        List<JsonNode> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String line : raw.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                JsonNode node = Jsons.mapper().readTree(trimmed);
                if (node != null && node.isObject()) {
                    out.add(node);
                }
            } catch (IOException ignored) {
                // malformed line
            }
        }
        return out;
    }

    private static void flush(List<TurnLog.Turn> turns, List<TurnLog.Step> assistantSteps) {
        if (!assistantSteps.isEmpty()) {
            turns.add(TurnLog.Turn.assistant(assistantSteps));
            assistantSteps.clear();
        }
    }

    private static Object parseArguments(JsonNode raw) {
        String value = raw == null || raw.isNull() ? "{}" : raw.asText("{}");
        try {
            return Jsons.mapper().readTree(value);
        } catch (IOException e) {
            return value;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? "" : value.asText("");
    }

    private record PendingCall(String toolName, Object arguments) {
    }
}
