package io.runscope.turns;

import com.fasterxml.jackson.databind.JsonNode;
import io.runscope.model.RunFormat;
import io.runscope.util.Jsons;
import io.runscope.util.OptionalFiles;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Rough cost estimate for one stage session: four characters per token, with tool output counted
 * at half weight as input context. Per-token prices come from the model catalog file the run
 * manifest points at, when there is one.
 */
public final class PricingEstimator {
    private static final String PROVIDER_FILE = "provider_used.json";

    public Optional<PricingEstimate> estimate(Path runDir, Path stageDir, TurnLog turns) {
        String modelId = turns.model() == null ? "" : turns.model();
        String profile = turns.profile() == null ? "" : turns.profile();
        Optional<String> provided = OptionalFiles.tryReadJson(stageDir.resolve(PROVIDER_FILE))
                .map(node -> node.path("model").asText(""))
                .filter(value -> !value.isEmpty());
        if (provided.isPresent()) {
            modelId = provided.get();
        }
        if (modelId.isEmpty()) {
            return Optional.empty();
        }

        double inputChars = 0;
        double outputChars = 0;
        for (TurnLog.Turn turn : turns.turns()) {
            if (turn.isUser()) {
                inputChars += turn.text() == null ? 0 : turn.text().length();
                continue;
            }
            for (TurnLog.Step step : turn.steps()) {
                if (step.text() != null) {
                    outputChars += step.text().length();
                }
                if (step.toolCall() != null && step.toolCall().output() != null) {
                    inputChars += step.toolCall().output().length() * 0.5d;
                }
            }
        }
        long inputTokens = Math.round(inputChars / 4.0d);
        long outputTokens = Math.round(outputChars / 4.0d);

        String lookupKey = profile.isEmpty() ? modelId : profile + "/" + modelId;
        Double promptPrice = null;
        Double completionPrice = null;
        Optional<JsonNode> entry = findCatalogEntry(runDir, lookupKey, modelId);
        if (entry.isPresent()) {
            JsonNode pricing = entry.get().path("pricing");
            promptPrice = price(pricing, "prompt");
            completionPrice = price(pricing, "completion");
        }
        Double cost = promptPrice != null && completionPrice != null
                ? inputTokens * promptPrice + outputTokens * completionPrice
                : null;
        return Optional.of(new PricingEstimate(lookupKey, inputTokens, outputTokens, cost, promptPrice, completionPrice));
    }

    private static Optional<JsonNode> findCatalogEntry(Path runDir, String lookupKey, String modelId) {
        Optional<String> catalogPath = OptionalFiles.tryReadJson(runDir.resolve(RunFormat.ATTRACTOR.markerFile()))
                .map(manifest -> Jsons.textField(manifest.path("modeldb"), "openrouter_model_info_path"));
        if (catalogPath.isEmpty()) {
            return Optional.empty();
        }
        Optional<JsonNode> catalog;
        try {
            catalog = OptionalFiles.tryReadJson(Path.of(catalogPath.get()));
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        if (catalog.isEmpty() || !catalog.get().path("data").isArray()) {
            return Optional.empty();
        }
        for (JsonNode model : catalog.get().path("data")) {
            String id = model.path("id").asText("");
            if (id.equals(lookupKey) || id.endsWith("/" + modelId) || id.equals(modelId)) {
                return Optional.of(model);
            }
        }
        return Optional.empty();
    }

    private static Double price(JsonNode pricing, String field) {
        String raw = pricing.path(field).asText("");
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
