package io.conclave.core.weight;

import static io.conclave.core.metric.DefaultMetrics.CODE_COMPLEXITY;
import static io.conclave.core.metric.DefaultMetrics.CODE_QUALITY;
import static io.conclave.core.metric.DefaultMetrics.FUNCTIONAL_IMPACT;
import static io.conclave.core.metric.DefaultMetrics.TEST_COVERAGE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conclave.core.metric.DefaultMetrics;
import io.conclave.core.metric.MetricDefinition;
import io.conclave.core.metric.MetricRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WeightTableTest {

    @Nested
    class Lookup {

        private final WeightTable table = DefaultWeights.expertise();

        @Test
        void shouldReturnConfiguredWeight() {
            assertThat(table.weight("senior-architect", CODE_COMPLEXITY)).isEqualTo(0.417);
            assertThat(table.weight("sdet", TEST_COVERAGE)).isEqualTo(0.4);
        }

        @Test
        void shouldResolveAliasesCaseInsensitively() {
            assertThat(table.weight("Developer (Reviewer)", CODE_QUALITY)).isEqualTo(0.417);
            assertThat(table.weight("  Business Analyst ", FUNCTIONAL_IMPACT)).isEqualTo(0.435);
            assertThat(table.normalizeRole("Test Automation Engineer")).isEqualTo("sdet");
        }

        @Test
        void shouldFallBackForUnknownRole() {
            assertThat(table.weight("product-owner", CODE_QUALITY))
                    .isEqualTo(WeightTable.UNKNOWN_ROLE_WEIGHT);
            assertThat(table.knowsRole("product-owner")).isFalse();
        }

        @Test
        void shouldWarnOnceForEachUnknownRole() {
            // Given: a fresh table and a handler capturing its warnings
            WeightTable fresh = WeightTable.builder().weight("lead", "speed", 1.0).build();
            Logger logger = Logger.getLogger(WeightTable.class.getName());
            List<LogRecord> warnings = new ArrayList<>();
            Handler capture =
                    new Handler() {
                        @Override
                        public void publish(LogRecord record) {
                            if (record.getLevel() == Level.WARNING) {
                                warnings.add(record);
                            }
                        }

                        @Override
                        public void flush() {}

                        @Override
                        public void close() {}
                    };
            logger.addHandler(capture);
            try {
                // When: two unknown roles are looked up across several metrics
                for (String metric : List.of("speed", "clarity", "depth")) {
                    fresh.weight("product-owner", metric);
                    fresh.weight("Product-Owner", metric);
                    fresh.weight("designer", metric);
                }
            } finally {
                logger.removeHandler(capture);
            }

            // Then
            assertThat(warnings)
                    .extracting(LogRecord::getMessage)
                    .containsExactly(
                            "Unknown role 'product-owner', using default weight 0.2",
                            "Unknown role 'designer', using default weight 0.2");
        }

        @Test
        void shouldReturnZeroForUnconfiguredMetricOfKnownRole() {
            assertThat(table.weight("sdet", "securityRisk")).isZero();
        }

        @Test
        void shouldIdentifyPrimaryRoles() {
            assertThat(table.isPrimary("business analyst", FUNCTIONAL_IMPACT)).isTrue();
            assertThat(table.isPrimary("sdet", FUNCTIONAL_IMPACT)).isFalse();
            assertThat(table.isPrimary("product-owner", FUNCTIONAL_IMPACT)).isFalse();
        }

        @Test
        void shouldListFiveDefaultRoles() {
            assertThat(table.roles()).containsExactlyElementsOf(DefaultWeights.roleKeys());
        }
    }

    @Nested
    class Construction {

        @Test
        void shouldRejectWeightAboveOne() {
            assertThatThrownBy(() -> WeightTable.builder().weight("sdet", CODE_QUALITY, 1.2))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("must be in [0, 1]");
        }

        @Test
        void shouldRejectNegativeWeight() {
            assertThatThrownBy(() -> WeightTable.builder().weight("sdet", CODE_QUALITY, -0.1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectBlankRole() {
            assertThatThrownBy(() -> WeightTable.builder().weight(" ", CODE_QUALITY, 0.5))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldAcceptDefaultTable() {
            assertThat(DefaultWeights.expertise().validate(DefaultMetrics.pillars())).isEmpty();
        }

        @Test
        void shouldReportUnbalancedMetrics() {
            MetricRegistry registry =
                    MetricRegistry.of(
                            MetricDefinition.required("quality", "Quality"),
                            MetricDefinition.nullable("speed", "Speed"));
            WeightTable table =
                    WeightTable.builder()
                            .weight("a", "quality", 0.5)
                            .weight("b", "quality", 0.5)
                            .weight("a", "speed", 0.3)
                            .build();

            List<String> problems = table.validate(registry);

            assertThat(problems).hasSize(1);
            assertThat(problems.get(0)).contains("speed").contains("0.300");
        }
    }
}
