package dk.cloudcreate.essentials.statebased.aggregates;

import org.slf4j.*;

import java.util.*;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A named, reusable business rule that can be checked against a target (typically the {@link AggregateState}).<br>
 * Rules compose with {@link #and(BusinessRule)}, {@link #or(BusinessRule)} and {@link #when(Predicate, String, BusinessRule)}
 * and are enforced by {@link StateAggregateRoot#validate(BusinessRule)}:
 * <pre>{@code
 * private static final BusinessRule<OrderState> IS_PENDING =
 *         BusinessRule.rule("order_is_pending",
 *                           state -> state.status == OrderStatus.PENDING,
 *                           state -> msg("Cannot confirm an order with status '{}'", state.status));
 * private static final BusinessRule<OrderState> HAS_ITEMS =
 *         BusinessRule.rule("order_has_items", state -> !state.items.isEmpty(), "Cannot confirm an order without items");
 *
 * public void confirm() {
 *     validate(IS_PENDING.and(HAS_ITEMS));
 *     ...
 * }
 * }</pre>
 * A rule whose predicate throws is considered broken.
 *
 * @param <T> the type of object the rule is checked against
 */
public interface BusinessRule<T> {
    /**
     * The rule name, e.g. <code>order_has_items</code>
     */
    String name();

    /**
     * Check the rule
     *
     * @param target the object to check
     * @return the violations, empty if the rule is satisfied
     */
    List<Violation> check(T target);

    default boolean isSatisfiedBy(T target) {
        return check(target).isEmpty();
    }

    /**
     * Both this and the <code>other</code> rule must be satisfied. Violations of both rules are reported
     */
    default BusinessRule<T> and(BusinessRule<? super T> other) {
        requireNonNull(other, "No other rule provided");
        var self = this;
        return new BusinessRule<>() {
            @Override
            public String name() {
                return self.name() + " and " + other.name();
            }

            @Override
            public List<Violation> check(T target) {
                var violations = new ArrayList<Violation>(self.check(target));
                violations.addAll(other.check(target));
                return violations;
            }
        };
    }

    /**
     * Either this or the <code>other</code> rule must be satisfied. If neither is, the violations of both rules are reported
     */
    default BusinessRule<T> or(BusinessRule<? super T> other) {
        requireNonNull(other, "No other rule provided");
        var self = this;
        return new BusinessRule<>() {
            @Override
            public String name() {
                return self.name() + " or " + other.name();
            }

            @Override
            public List<Violation> check(T target) {
                var violations = self.check(target);
                if (violations.isEmpty()) {
                    return violations;
                }
                var otherViolations = other.check(target);
                if (otherViolations.isEmpty()) {
                    return otherViolations;
                }
                var combined = new ArrayList<Violation>(violations);
                combined.addAll(otherViolations);
                return combined;
            }
        };
    }

    static <T> BusinessRule<T> rule(String name, Predicate<? super T> predicate, String message) {
        requireNonNull(message, "No message provided");
        return rule(name, predicate, target -> message);
    }

    /**
     * Create a rule
     *
     * @param name      the rule name
     * @param predicate returns true when the rule is satisfied
     * @param message   creates the violation message from the target
     * @param <T>       the type of object the rule is checked against
     * @return the rule
     */
    static <T> BusinessRule<T> rule(String name, Predicate<? super T> predicate, Function<? super T, String> message) {
        requireNonNull(name, "No name provided");
        requireNonNull(predicate, "No predicate provided");
        requireNonNull(message, "No message provided");
        return new BusinessRule<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public List<Violation> check(T target) {
                try {
                    if (predicate.test(target)) {
                        return List.of();
                    }
                } catch (RuntimeException e) {
                    LoggerFactory.getLogger(BusinessRule.class).debug(msg("Rule '{}' failed while being checked", name), e);
                    return List.of(new Violation(name, msg("{} ({})", message.apply(target), e.getMessage())));
                }
                return List.of(new Violation(name, message.apply(target)));
            }

            @Override
            public String toString() {
                return "BusinessRule(" + name + ")";
            }
        };
    }

    /**
     * A rule that only applies when the <code>condition</code> is met, otherwise it's satisfied
     *
     * @param condition            decides if the rule applies
     * @param conditionDescription describes the condition, e.g. <code>order is being delivered</code>
     * @param rule                 the rule that applies when the condition is met
     * @param <T>                  the type of object the rule is checked against
     * @return the conditional rule
     */
    static <T> BusinessRule<T> when(Predicate<? super T> condition, String conditionDescription, BusinessRule<T> rule) {
        requireNonNull(condition, "No condition provided");
        requireNonNull(conditionDescription, "No conditionDescription provided");
        requireNonNull(rule, "No rule provided");
        return new BusinessRule<>() {
            @Override
            public String name() {
                return rule.name() + " when " + conditionDescription;
            }

            @Override
            public List<Violation> check(T target) {
                if (!condition.test(target)) {
                    return List.of();
                }
                return rule.check(target);
            }
        };
    }

    /**
     * A broken rule
     */
    final class Violation {
        public final String ruleName;
        public final String message;

        public Violation(String ruleName, String message) {
            this.ruleName = requireNonNull(ruleName, "No ruleName provided");
            this.message = requireNonNull(message, "No message provided");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Violation violation = (Violation) o;
            return ruleName.equals(violation.ruleName) && message.equals(violation.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ruleName, message);
        }

        @Override
        public String toString() {
            return ruleName + ": " + message;
        }
    }
}
