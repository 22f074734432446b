package io.runscope.replay;

import com.fasterxml.jackson.databind.JsonNode;
import io.runscope.util.Jsons;

import java.util.Optional;

/**
 * One parsed line of {@code progress.ndjson}.
 *
 * <p>Main-stage fields ({@code nodeId}, {@code attempt}, {@code status}) and branch fields
 * ({@code branchKind}, {@code branchKey}, ...) are populated from whichever keys the line carries;
 * the replayer decides which ones matter for the event kind.
 */
public record ProgressEvent(
        ProgressEventKind kind,
        String ts,
        String nodeId,
        int attempt,
        String status,
        String failureReason,
        ProgressEventKind branchKind,
        String branchKey,
        String branchNodeId,
        int branchAttempt,
        String branchStatus,
        String branchFailureReason,
        String branchLogsRoot,
        String signature,
        int signatureCount,
        int signatureLimit,
        String newLogsRoot
) {
    public static Optional<ProgressEvent> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(line);
        } catch (Exception e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        return Optional.of(fromNode(node));
    }

    static ProgressEvent fromNode(JsonNode node) {
        Integer attempt = Jsons.intField(node, "attempt");
        Integer branchAttempt = Jsons.intField(node, "branch_attempt");
        Integer count = Jsons.intField(node, "signature_count");
        Integer limit = Jsons.intField(node, "signature_limit");
        String signature = Jsons.textField(node, "signature");
        return new ProgressEvent(
                ProgressEventKind.fromString(Jsons.textField(node, "event")),
                Jsons.textField(node, "ts"),
                Jsons.textField(node, "node_id"),
                attempt == null ? 1 : attempt,
                textOrEmpty(node.get("status")),
                Jsons.textField(node, "failure_reason"),
                ProgressEventKind.fromString(textOrEmpty(node.get("branch_event"))),
                Jsons.textField(node, "branch_key"),
                Jsons.textField(node, "branch_node_id"),
                branchAttempt == null ? 1 : branchAttempt,
                textOrEmpty(node.get("branch_status")),
                Jsons.textField(node, "branch_failure_reason"),
                Jsons.textField(node, "branch_logs_root"),
                signature == null ? "" : signature,
                count == null ? 0 : count,
                limit == null ? 0 : limit,
                Jsons.textField(node, "new_logs_root")
        );
    }

    public boolean hasTimestamp() {
        return ts != null;
    }

    private static String textOrEmpty(JsonNode value) {
        return value == null || value.isNull() ? "" : value.asText("");
    }
}
