package work.lcod.session.state;

import java.util.OptionalDouble;

/**
 * Estimated run time of a run list in seconds, split between automated and manual jobs.
 * A bucket is empty when some job in it has no usable estimate.
 */
public record DurationEstimate(OptionalDouble automated, OptionalDouble manual) {
    public OptionalDouble total() {
        if (automated.isPresent() && manual.isPresent()) {
            return OptionalDouble.of(automated.getAsDouble() + manual.getAsDouble());
        }
        return OptionalDouble.empty();
    }
}
