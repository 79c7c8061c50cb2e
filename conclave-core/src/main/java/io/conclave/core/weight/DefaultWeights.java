package io.conclave.core.weight;

import static io.conclave.core.metric.DefaultMetrics.ACTUAL_TIME_HOURS;
import static io.conclave.core.metric.DefaultMetrics.CODE_COMPLEXITY;
import static io.conclave.core.metric.DefaultMetrics.CODE_QUALITY;
import static io.conclave.core.metric.DefaultMetrics.DEBT_REDUCTION_HOURS;
import static io.conclave.core.metric.DefaultMetrics.FUNCTIONAL_IMPACT;
import static io.conclave.core.metric.DefaultMetrics.IDEAL_TIME_HOURS;
import static io.conclave.core.metric.DefaultMetrics.TECHNICAL_DEBT_HOURS;
import static io.conclave.core.metric.DefaultMetrics.TEST_COVERAGE;

import java.util.List;

/// Built-in expertise weights for the five default reviewer roles.
///
/// Each metric column sums to 1.0 (within rounding), so every metric has exactly one
/// role at or above the primary threshold.
public final class DefaultWeights {

    public static final String BUSINESS_ANALYST = "business-analyst";
    public static final String SDET = "sdet";
    public static final String DEVELOPER_AUTHOR = "developer-author";
    public static final String SENIOR_ARCHITECT = "senior-architect";
    public static final String DEVELOPER_REVIEWER = "developer-reviewer";

    // Column order for the rows below.
    private static final List<String> METRICS =
            List.of(
                    FUNCTIONAL_IMPACT,
                    IDEAL_TIME_HOURS,
                    TEST_COVERAGE,
                    CODE_QUALITY,
                    CODE_COMPLEXITY,
                    ACTUAL_TIME_HOURS,
                    TECHNICAL_DEBT_HOURS,
                    DEBT_REDUCTION_HOURS);

    private static final WeightTable EXPERTISE = createExpertise();

    private DefaultWeights() {}

    /// Returns the default five-role weight table, including display-name aliases.
    public static WeightTable expertise() {
        return EXPERTISE;
    }

    public static List<String> roleKeys() {
        return List.of(
                BUSINESS_ANALYST, SDET, DEVELOPER_AUTHOR, SENIOR_ARCHITECT, DEVELOPER_REVIEWER);
    }

    private static WeightTable createExpertise() {
        WeightTable.Builder builder = WeightTable.builder();
        row(builder, BUSINESS_ANALYST, 0.435, 0.417, 0.12, 0.083, 0.083, 0.136, 0.13, 0.13);
        row(builder, SDET, 0.13, 0.083, 0.4, 0.167, 0.125, 0.091, 0.13, 0.13);
        row(builder, DEVELOPER_AUTHOR, 0.13, 0.167, 0.12, 0.125, 0.167, 0.455, 0.13, 0.13);
        row(builder, SENIOR_ARCHITECT, 0.174, 0.208, 0.16, 0.208, 0.417, 0.182, 0.435, 0.435);
        row(builder, DEVELOPER_REVIEWER, 0.13, 0.125, 0.2, 0.417, 0.208, 0.136, 0.174, 0.174);

        builder.alias("business analyst", BUSINESS_ANALYST)
                .alias("sdet (test automation engineer)", SDET)
                .alias("test automation engineer", SDET)
                .alias("developer (author)", DEVELOPER_AUTHOR)
                .alias("developer author", DEVELOPER_AUTHOR)
                .alias("senior architect", SENIOR_ARCHITECT)
                .alias("developer reviewer", DEVELOPER_REVIEWER)
                .alias("developer (reviewer)", DEVELOPER_REVIEWER);
        return builder.build();
    }

    private static void row(WeightTable.Builder builder, String role, double... weights) {
        for (int i = 0; i < METRICS.size(); i++) {
            builder.weight(role, METRICS.get(i), weights[i]);
        }
    }
}
