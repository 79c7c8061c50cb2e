package io.conclave.core.worker;

/// Resources consumed by a worker invocation, such as model tokens and cost.
///
/// @param inputUnits units consumed reading input, non-negative
/// @param outputUnits units produced, non-negative
/// @param cost monetary cost in the caller's currency, non-negative
public record ResourceUsage(long inputUnits, long outputUnits, double cost) {

    public static final ResourceUsage ZERO = new ResourceUsage(0, 0, 0.0);

    public ResourceUsage {
        if (inputUnits < 0 || outputUnits < 0 || cost < 0) {
            throw new IllegalArgumentException(
                    "Resource usage must be non-negative: in="
                            + inputUnits
                            + ", out="
                            + outputUnits
                            + ", cost="
                            + cost);
        }
    }

    public ResourceUsage plus(ResourceUsage other) {
        if (other == null) {
            return this;
        }
        return new ResourceUsage(
                inputUnits + other.inputUnits, outputUnits + other.outputUnits, cost + other.cost);
    }

    public long totalUnits() {
        return inputUnits + outputUnits;
    }
}
