package dk.cloudcreate.essentials.statebased.transaction;

import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * This interface creates and keeps track of the {@link UnitOfWork} bound to the current thread.<br>
 * Each command gets a fresh {@link UnitOfWork}. Starting a {@link UnitOfWork} while another one is active (e.g. a command
 * sent from within an event handler) suspends the outer {@link UnitOfWork} until the inner one is removed again.
 */
public interface UnitOfWorkFactory {
    /**
     * Get a required active {@link UnitOfWork}
     *
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if the is no active {@link UnitOfWork}
     */
    UnitOfWork getRequiredUnitOfWork();

    /**
     * Get the {@link UnitOfWork} bound to the current thread
     *
     * @return the active {@link UnitOfWork} or {@link Optional#empty()}
     */
    Optional<UnitOfWork> getCurrentUnitOfWork();

    /**
     * Create a new {@link UnitOfWork} and bind it to the current thread
     *
     * @return the new {@link UnitOfWork}
     */
    UnitOfWork createUnitOfWork();

    /**
     * Unbind the {@link UnitOfWork} from the current thread, restoring any {@link UnitOfWork} that was active when it was created
     *
     * @param unitOfWork the {@link UnitOfWork} to remove. Must be the currently active {@link UnitOfWork}
     */
    void removeUnitOfWork(UnitOfWork unitOfWork);

    /**
     * Run the consumer within a new {@link UnitOfWork}. The {@link UnitOfWork} is cleared and removed afterwards
     *
     * @param unitOfWorkConsumer the consumer
     */
    default void usingUnitOfWork(CheckedConsumer<UnitOfWork> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    /**
     * Run the function within a new {@link UnitOfWork}. The {@link UnitOfWork} is cleared and removed afterwards
     *
     * @param unitOfWorkFunction the function
     * @param <R>                the result type
     * @return the result of the function
     */
    default <R> R withUnitOfWork(CheckedFunction<UnitOfWork, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var unitOfWork = createUnitOfWork();
        try {
            return unitOfWorkFunction.apply(unitOfWork);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new UnitOfWorkException(e);
        } finally {
            unitOfWork.clear();
            removeUnitOfWork(unitOfWork);
        }
    }

    /**
     * Create a {@link UnitOfWorkFactory} that keeps the active {@link UnitOfWork} in a {@link ThreadLocal}
     */
    static UnitOfWorkFactory threadBound() {
        return new ThreadBoundUnitOfWorkFactory();
    }

    class ThreadBoundUnitOfWorkFactory implements UnitOfWorkFactory {
        private static final Logger log = LoggerFactory.getLogger(ThreadBoundUnitOfWorkFactory.class);

        /**
         * The active {@link UnitOfWork} is on top, suspended outer {@link UnitOfWork}'s below it
         */
        private final ThreadLocal<Deque<UnitOfWork>> unitsOfWork = ThreadLocal.withInitial(ArrayDeque::new);

        @Override
        public UnitOfWork getRequiredUnitOfWork() {
            return getCurrentUnitOfWork().orElseThrow(() -> new NoActiveUnitOfWorkException("No active UnitOfWork bound to the current thread"));
        }

        @Override
        public Optional<UnitOfWork> getCurrentUnitOfWork() {
            return Optional.ofNullable(unitsOfWork.get().peek());
        }

        @Override
        public UnitOfWork createUnitOfWork() {
            var stack = unitsOfWork.get();
            if (!stack.isEmpty()) {
                log.debug("Suspending the active UnitOfWork while a nested UnitOfWork is active (nesting depth {})", stack.size());
            }
            var unitOfWork = new UnitOfWork.DefaultUnitOfWork();
            stack.push(unitOfWork);
            log.trace("Created {}", unitOfWork);
            return unitOfWork;
        }

        @Override
        public void removeUnitOfWork(UnitOfWork unitOfWork) {
            requireNonNull(unitOfWork, "No unitOfWork provided");
            var stack = unitsOfWork.get();
            if (stack.peek() != unitOfWork) {
                throw new UnitOfWorkException(msg("Cannot remove {} since it isn't the active UnitOfWork", unitOfWork));
            }
            stack.pop();
            if (stack.isEmpty()) {
                unitsOfWork.remove();
            } else {
                log.trace("Resuming the outer UnitOfWork (nesting depth {})", stack.size());
            }
        }
    }
}
