package io.conclave.core.execution.aggregate;

import static io.conclave.core.metric.DefaultMetrics.CODE_COMPLEXITY;
import static io.conclave.core.metric.DefaultMetrics.CODE_QUALITY;
import static io.conclave.core.metric.DefaultMetrics.FUNCTIONAL_IMPACT;
import static io.conclave.core.metric.DefaultMetrics.TECHNICAL_DEBT_HOURS;
import static io.conclave.core.metric.DefaultMetrics.TEST_COVERAGE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.conclave.core.ResultFixtures;
import io.conclave.core.metric.DefaultMetrics;
import io.conclave.core.metric.MetricDefinition;
import io.conclave.core.metric.MetricRegistry;
import io.conclave.core.metric.Scorecard;
import io.conclave.core.weight.DefaultWeights;
import io.conclave.core.weight.WeightTable;
import io.conclave.core.worker.WorkerResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WeightedAggregatorTest {

    private WeightedAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new WeightedAggregator(DefaultWeights.expertise(), DefaultMetrics.pillars());
    }

    private static WorkerResult scored(String workerId, String role, Scorecard card) {
        return ResultFixtures.result(workerId, role, "Summary", card);
    }

    @Nested
    class WeightedMean {

        @Test
        void shouldWeightByRoleExpertise() {
            // Given: architect (0.417) and reviewer (0.208) disagree on complexity
            WorkerResult architect =
                    scored(
                            "w1",
                            "senior-architect",
                            Scorecard.builder().put(CODE_COMPLEXITY, 8.0).build());
            WorkerResult reviewer =
                    scored(
                            "w2",
                            "developer-reviewer",
                            Scorecard.builder().put(CODE_COMPLEXITY, 4.0).build());

            // When
            Scorecard aggregated = aggregator.aggregate(List.of(architect, reviewer));

            // Then: (8 * 0.417 + 4 * 0.208) / (0.417 + 0.208)
            assertThat(aggregated.get(CODE_COMPLEXITY)).isCloseTo(6.6688, within(1e-9));
        }

        @Test
        void shouldIgnoreNullContributions() {
            // Given: architect abstains on coverage, sdet scores 6
            WorkerResult architect =
                    scored(
                            "w1",
                            "senior-architect",
                            Scorecard.builder().put(TEST_COVERAGE, null).build());
            WorkerResult sdet =
                    scored("w2", "sdet", Scorecard.builder().put(TEST_COVERAGE, 6.0).build());

            // When
            Scorecard aggregated = aggregator.aggregate(List.of(architect, sdet));

            // Then: the abstention neither pulls toward zero nor dilutes the weight
            assertThat(aggregated.get(TEST_COVERAGE)).isCloseTo(6.0, within(1e-12));
        }

        @Test
        void shouldRenormalizeOverNonNullContributors() {
            // Given: architect and reviewer score complexity, sdet abstains
            WeightTable table = DefaultWeights.expertise();
            WorkerResult architect =
                    scored(
                            "w1",
                            "senior-architect",
                            Scorecard.builder().put(CODE_COMPLEXITY, 8.0).build());
            WorkerResult sdet =
                    scored("w2", "sdet", Scorecard.builder().put(CODE_COMPLEXITY, null).build());
            WorkerResult reviewer =
                    scored(
                            "w3",
                            "developer-reviewer",
                            Scorecard.builder().put(CODE_COMPLEXITY, 4.0).build());

            // When
            Scorecard aggregated = aggregator.aggregate(List.of(architect, sdet, reviewer));

            // Then: (wA * vA + wB * vB) / (wA + wB), the sdet weight plays no part
            double wA = table.weight("senior-architect", CODE_COMPLEXITY);
            double wB = table.weight("developer-reviewer", CODE_COMPLEXITY);
            assertThat(table.weight("sdet", CODE_COMPLEXITY)).isPositive();
            assertThat(aggregated.get(CODE_COMPLEXITY))
                    .isCloseTo((wA * 8.0 + wB * 4.0) / (wA + wB), within(1e-12));
        }

        @Test
        void shouldProduceIdenticalScorecardForRepeatedCalls() {
            List<WorkerResult> results = new ArrayList<>();
            int i = 0;
            for (String role : DefaultWeights.roleKeys()) {
                results.add(ResultFixtures.uniform("w" + i, role, 1.3 + i * 2.1));
                i++;
            }

            Scorecard first = aggregator.aggregate(results);
            Scorecard second = aggregator.aggregate(results);

            assertThat(second).isEqualTo(first);
        }

        @Test
        void shouldOmitMetricWithoutContributors() {
            WorkerResult sdet =
                    scored(
                            "w1",
                            "sdet",
                            Scorecard.builder()
                                    .put(CODE_QUALITY, 7.0)
                                    .put(FUNCTIONAL_IMPACT, null)
                                    .build());

            Scorecard aggregated = aggregator.aggregate(List.of(sdet));

            assertThat(aggregated.contains(FUNCTIONAL_IMPACT)).isFalse();
            assertThat(aggregated.contains(TEST_COVERAGE)).isFalse();
            assertThat(aggregated.asMap()).doesNotContainValue(null);
        }

        @Test
        void shouldReturnEmptyScorecardForNoResults() {
            assertThat(aggregator.aggregate(List.of()).isEmpty()).isTrue();
        }

        @Test
        void shouldUseFallbackWeightForUnknownRole() {
            WorkerResult unknown =
                    scored("w1", "product-owner", Scorecard.builder().put(CODE_QUALITY, 9.0).build());
            WorkerResult reviewer =
                    scored(
                            "w2",
                            "developer-reviewer",
                            Scorecard.builder().put(CODE_QUALITY, 5.0).build());

            Scorecard aggregated = aggregator.aggregate(List.of(unknown, reviewer));

            // (9 * 0.2 + 5 * 0.417) / 0.617
            assertThat(aggregated.get(CODE_QUALITY))
                    .isCloseTo((9 * 0.2 + 5 * 0.417) / 0.617, within(1e-9));
        }

        @Test
        void shouldFallBackToPlainMeanWhenWeightsSumToZero() {
            MetricRegistry registry = MetricRegistry.of(MetricDefinition.nullable("speed", "Speed"));
            WeightTable table =
                    WeightTable.builder().weight("a", "speed", 0.0).weight("b", "speed", 0.0).build();
            WeightedAggregator zeroWeighted = new WeightedAggregator(table, registry);

            Scorecard aggregated =
                    zeroWeighted.aggregate(
                            List.of(
                                    scored("w1", "a", Scorecard.builder().put("speed", 2.0).build()),
                                    scored("w2", "b", Scorecard.builder().put("speed", 6.0).build())));

            assertThat(aggregated.get("speed")).isEqualTo(4.0);
        }

        @Test
        void shouldNotDependOnResultOrder() {
            List<WorkerResult> results = new ArrayList<>();
            int i = 0;
            for (String role : DefaultWeights.roleKeys()) {
                results.add(ResultFixtures.uniform("w" + i, role, 2.0 + i * 1.5));
                i++;
            }
            Scorecard forward = aggregator.aggregate(results);
            Collections.reverse(results);
            Scorecard backward = aggregator.aggregate(results);

            assertThat(backward.metricNames()).containsExactlyElementsOf(forward.metricNames());
            for (String metric : forward.metricNames()) {
                assertThat(backward.get(metric)).isCloseTo(forward.get(metric), within(1e-9));
            }
        }
    }

    @Nested
    class PrimaryGaps {

        @Test
        void shouldReportPrimaryRoleAbstention() {
            // Given: architect is primary (0.435) for technical debt but returns null
            WorkerResult architect =
                    scored(
                            "w-arch",
                            "Senior Architect",
                            Scorecard.builder()
                                    .put(CODE_QUALITY, 7.0)
                                    .put(CODE_COMPLEXITY, 5.0)
                                    .put(TECHNICAL_DEBT_HOURS, null)
                                    .put(DefaultMetrics.IDEAL_TIME_HOURS, 2.0)
                                    .put(DefaultMetrics.DEBT_REDUCTION_HOURS, 0.0)
                                    .build());

            // When
            List<AggregationGap> gaps = aggregator.findPrimaryGaps(List.of(architect));

            // Then: complexity (0.417) is scored, both debt metrics checked
            assertThat(gaps)
                    .extracting(AggregationGap::metric)
                    .containsExactly(TECHNICAL_DEBT_HOURS);
            assertThat(gaps.get(0).roleKey()).isEqualTo("senior-architect");
            assertThat(gaps.get(0).weight()).isEqualTo(0.435);
        }

        @Test
        void shouldIgnoreUnknownRoles() {
            WorkerResult unknown = scored("w1", "product-owner", Scorecard.empty());

            assertThat(aggregator.findPrimaryGaps(List.of(unknown))).isEmpty();
        }

        @Test
        void shouldStillAggregateOtherContributors() {
            WorkerResult architect =
                    scored(
                            "w1",
                            "senior-architect",
                            Scorecard.builder().put(TECHNICAL_DEBT_HOURS, null).build());
            WorkerResult analyst =
                    scored(
                            "w2",
                            "business-analyst",
                            Scorecard.builder().put(TECHNICAL_DEBT_HOURS, 3.0).build());

            Scorecard aggregated = aggregator.aggregate(List.of(architect, analyst));

            assertThat(aggregated.get(TECHNICAL_DEBT_HOURS)).isCloseTo(3.0, within(1e-12));
        }
    }
}
