package io.conclave.core.metric;

/// The stock eight-pillar metric set used to score a code change.
///
/// Seven pillars are presented to users; the eighth raw metric
/// (`debtReductionHours`) is collected separately so that net debt can be derived
/// (see {@link DerivedMetrics#netDebt(Scorecard)}). Only `codeQuality` and
/// `codeComplexity` are required; every role can judge those from the diff alone.
public final class DefaultMetrics {

    public static final String FUNCTIONAL_IMPACT = "functionalImpact";
    public static final String IDEAL_TIME_HOURS = "idealTimeHours";
    public static final String TEST_COVERAGE = "testCoverage";
    public static final String CODE_QUALITY = "codeQuality";
    public static final String CODE_COMPLEXITY = "codeComplexity";
    public static final String ACTUAL_TIME_HOURS = "actualTimeHours";
    public static final String TECHNICAL_DEBT_HOURS = "technicalDebtHours";
    public static final String DEBT_REDUCTION_HOURS = "debtReductionHours";

    private static final MetricRegistry PILLARS =
            MetricRegistry.of(
                    new MetricDefinition(
                            FUNCTIONAL_IMPACT,
                            "Functional Impact",
                            "User-facing impact and business value (1-10, higher is more)",
                            true),
                    new MetricDefinition(
                            IDEAL_TIME_HOURS,
                            "Ideal Time Hours",
                            "Effort the change should have taken under ideal conditions",
                            true),
                    new MetricDefinition(
                            TEST_COVERAGE,
                            "Test Coverage",
                            "Quality and extent of test automation (1-10)",
                            true),
                    new MetricDefinition(
                            CODE_QUALITY,
                            "Code Quality",
                            "Cleanliness, maintainability and readability (1-10)",
                            false),
                    new MetricDefinition(
                            CODE_COMPLEXITY,
                            "Code Complexity",
                            "Cognitive and architectural complexity (1-10, lower is better)",
                            false),
                    new MetricDefinition(
                            ACTUAL_TIME_HOURS,
                            "Actual Time Hours",
                            "Effort the change actually took",
                            true),
                    new MetricDefinition(
                            TECHNICAL_DEBT_HOURS,
                            "Technical Debt Hours",
                            "Debt introduced by the change, in hours",
                            true),
                    new MetricDefinition(
                            DEBT_REDUCTION_HOURS,
                            "Debt Reduction Hours",
                            "Debt paid down by the change, in hours",
                            true));

    private DefaultMetrics() {}

    /// Returns the eight-pillar registry.
    ///
    /// @return shared immutable registry, never null
    public static MetricRegistry pillars() {
        return PILLARS;
    }
}
