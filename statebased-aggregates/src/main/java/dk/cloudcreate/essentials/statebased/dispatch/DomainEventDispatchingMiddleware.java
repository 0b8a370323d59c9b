package dk.cloudcreate.essentials.statebased.dispatch;

import dk.cloudcreate.essentials.statebased.command.*;
import dk.cloudcreate.essentials.statebased.transaction.*;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Runs each command within a fresh {@link UnitOfWork} and, once the command has succeeded, dispatches the pending
 * events of every aggregate registered with the {@link UnitOfWork} using the {@link DomainEventDispatcher}.<br>
 * Events are dispatched only after the command handler (and with it every repository write) has completed successfully.
 * If the command fails, or throws, no events are dispatched.<br>
 * In every case the {@link UnitOfWork} is cleared and removed afterwards, so no pending event survives the command.<br>
 * Handler failures don't change the result of the command.
 */
public class DomainEventDispatchingMiddleware implements CommandMiddleware {
    private static final Logger log = LoggerFactory.getLogger(DomainEventDispatchingMiddleware.class);

    private final UnitOfWorkFactory     unitOfWorkFactory;
    private final DomainEventDispatcher dispatcher;

    public DomainEventDispatchingMiddleware(UnitOfWorkFactory unitOfWorkFactory, DomainEventDispatcher dispatcher) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.dispatcher = requireNonNull(dispatcher, "No dispatcher provided");
    }

    @Override
    public <R> OperationResult<R> intercept(Command<R> command, NextCommandHandler next) {
        var unitOfWork = unitOfWorkFactory.createUnitOfWork();
        try {
            var result = next.handle(command);
            if (result.isFailure()) {
                log.debug("[{}] Command failed with {}. Skipping dispatch of {} pending event(s)",
                          command.getClass().getSimpleName(),
                          result.failureReason().get(),
                          unitOfWork.pendingEvents().size());
                return result;
            }
            if (unitOfWork.hasChanges()) {
                var events   = unitOfWork.pendingEvents();
                var failures = dispatcher.dispatch(events);
                if (failures > 0) {
                    log.warn("[{}] {} event handler invocation(s) failed while dispatching {} event(s)",
                             command.getClass().getSimpleName(),
                             failures,
                             events.size());
                } else {
                    log.debug("[{}] Dispatched {} event(s)", command.getClass().getSimpleName(), events.size());
                }
            }
            return result;
        } finally {
            unitOfWork.clear();
            unitOfWorkFactory.removeUnitOfWork(unitOfWork);
        }
    }
}
