package io.conclave.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.conclave.core.metric.MetricDefinition;
import io.conclave.core.metric.MetricRegistry;
import io.conclave.core.weight.WeightTable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Reads evaluation profiles from JSON.
///
/// ### Format
/// ```json
/// {
///   "metrics": [
///     {"name": "codeQuality", "displayName": "Code Quality", "nullable": false}
///   ],
///   "weights": {"developer-reviewer": {"codeQuality": 0.417}},
///   "aliases": {"Developer Reviewer": "developer-reviewer"}
/// }
/// ```
///
/// `displayName`, `description` and `nullable` are optional; metrics are nullable by
/// default. `aliases` is optional. Weight sums are checked and logged, never enforced.
///
/// @implNote Thread-safe. Uses a private ObjectMapper for tree parsing only.
public final class EvaluationProfileParser {

    private static final Logger logger = Logger.getLogger(EvaluationProfileParser.class.getName());

    private final ObjectMapper mapper = new ObjectMapper();

    /// Parses a profile from a JSON string.
    ///
    /// @param json profile JSON, not null
    /// @return the parsed profile, never null
    /// @throws IllegalArgumentException if the JSON is malformed or the profile is invalid
    public EvaluationProfile parse(String json) {
        try {
            return toProfile(mapper.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to parse evaluation profile: " + e.getMessage(), e);
        }
    }

    /// Parses a profile from a stream. The stream is not closed.
    ///
    /// @param input JSON stream, not null
    /// @return the parsed profile, never null
    /// @throws IllegalArgumentException if the JSON is malformed or the profile is invalid
    public EvaluationProfile parse(InputStream input) {
        try {
            return toProfile(mapper.readTree(input));
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to parse evaluation profile: " + e.getMessage(), e);
        }
    }

    /// Parses a profile file.
    ///
    /// @param path JSON file, not null
    /// @return the parsed profile, never null
    /// @throws IllegalArgumentException if the file cannot be read or the profile is invalid
    public EvaluationProfile parse(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            return parse(input);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to read evaluation profile " + path + ": " + e.getMessage(), e);
        }
    }

    private EvaluationProfile toProfile(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Evaluation profile must be a JSON object");
        }
        MetricRegistry registry = parseMetrics(root.path("metrics"));
        WeightTable weights = parseWeights(root.path("weights"), root.path("aliases"), registry);

        List<String> problems = weights.validate(registry);
        if (!problems.isEmpty()) {
            logger.warning("Evaluation profile has " + problems.size() + " unbalanced metrics");
        }
        return new EvaluationProfile(registry, weights);
    }

    private static MetricRegistry parseMetrics(JsonNode metrics) {
        if (!metrics.isArray() || metrics.isEmpty()) {
            throw new IllegalArgumentException("Profile must declare a non-empty 'metrics' array");
        }
        List<MetricDefinition> definitions = new ArrayList<>();
        for (JsonNode metric : metrics) {
            String name = metric.path("name").asText("");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Every metric needs a non-blank 'name'");
            }
            definitions.add(
                    new MetricDefinition(
                            name,
                            metric.hasNonNull("displayName")
                                    ? metric.get("displayName").asText()
                                    : null,
                            metric.path("description").asText(""),
                            metric.path("nullable").asBoolean(true)));
        }
        return MetricRegistry.of(definitions);
    }

    private static WeightTable parseWeights(
            JsonNode weights, JsonNode aliases, MetricRegistry registry) {
        if (!weights.isObject()) {
            throw new IllegalArgumentException("Profile must declare a 'weights' object");
        }
        WeightTable.Builder builder = WeightTable.builder();

        Iterator<Map.Entry<String, JsonNode>> roles = weights.fields();
        while (roles.hasNext()) {
            Map.Entry<String, JsonNode> role = roles.next();
            Iterator<Map.Entry<String, JsonNode>> entries = role.getValue().fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                String metric = entry.getKey();
                if (!registry.contains(metric)) {
                    throw new IllegalArgumentException(
                            "Weight for role '"
                                    + role.getKey()
                                    + "' references unknown metric '"
                                    + metric
                                    + "'");
                }
                if (!entry.getValue().isNumber()) {
                    throw new IllegalArgumentException(
                            "Weight for role '"
                                    + role.getKey()
                                    + "' and metric '"
                                    + metric
                                    + "' must be a number");
                }
                builder.weight(role.getKey(), metric, entry.getValue().doubleValue());
            }
        }

        if (aliases.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> entries = aliases.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> alias = entries.next();
                builder.alias(alias.getKey(), alias.getValue().asText());
            }
        }
        return builder.build();
    }
}
