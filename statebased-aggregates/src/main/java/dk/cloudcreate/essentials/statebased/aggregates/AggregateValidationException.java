package dk.cloudcreate.essentials.statebased.aggregates;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an aggregate refuses a state transition or a value object refuses its input.<br>
 * It's always thrown before any state change or event registration takes place.
 */
public class AggregateValidationException extends AggregateException {
    public final Object                       aggregateId;
    public final Class<?>                     aggregateType;
    /**
     * The broken rules when the exception was caused by {@link StateAggregateRoot#validate(BusinessRule)}, otherwise empty
     */
    public final List<BusinessRule.Violation> violations;

    public AggregateValidationException(String message) {
        super(message);
        this.aggregateId = null;
        this.aggregateType = null;
        this.violations = List.of();
    }

    public AggregateValidationException(Object aggregateId, Class<?> aggregateType, String reason) {
        super(msg("[{}:{}] {}",
                  aggregateType.getSimpleName(),
                  aggregateId,
                  reason));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.violations = List.of();
    }

    public AggregateValidationException(Object aggregateId, Class<?> aggregateType, List<BusinessRule.Violation> violations) {
        super(msg("[{}:{}] {}",
                  aggregateType.getSimpleName(),
                  aggregateId,
                  violations.stream()
                            .map(violation -> violation.message)
                            .collect(Collectors.joining("; "))));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.violations = List.copyOf(violations);
    }
}
