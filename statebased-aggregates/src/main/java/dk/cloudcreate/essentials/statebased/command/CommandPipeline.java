package dk.cloudcreate.essentials.statebased.command;

import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Sends commands to their {@link CommandHandler} through a chain of {@link CommandMiddleware}'s.<br>
 * The chain for each command type is composed once by {@link Builder#build()}, sending a command only walks the prebuilt chain:
 * <pre>{@code
 * var pipeline = CommandPipeline.builder()
 *                               .addMiddleware(new LoggingCommandMiddleware())
 *                               .addMiddleware(new DomainEventDispatchingMiddleware(unitOfWorkFactory, dispatcher))
 *                               .addMiddleware(new ConcurrencyConflictRetryMiddleware(unitOfWorkFactory, ConflictRetryPolicy.fixedBackoff(Duration.ofMillis(10), 3)))
 *                               .addMiddleware(new ExceptionTranslatingMiddleware())
 *                               .addHandler(ConfirmOrder.class, new ConfirmOrderHandler(orders, unitOfWorkFactory))
 *                               .build();
 * OperationResult<Void> result = pipeline.send(new ConfirmOrder(orderId));
 * }</pre>
 */
public interface CommandPipeline {
    /**
     * Send the command through the middleware chain to its handler
     *
     * @param command the command
     * @param <R>     the result value type
     * @return the result
     * @throws CommandHandlerNotFoundException if no handler is registered for the command type
     */
    <R> OperationResult<R> send(Command<R> command);

    static Builder builder() {
        return new Builder();
    }

    class Builder {
        private final List<CommandMiddleware>              middlewares = new ArrayList<>();
        private final Map<Class<?>, CommandHandler<?, ?>> handlers    = new LinkedHashMap<>();

        public Builder addMiddleware(CommandMiddleware middleware) {
            middlewares.add(requireNonNull(middleware, "No middleware provided"));
            return this;
        }

        public <C extends Command<R>, R> Builder addHandler(Class<C> commandType, CommandHandler<C, R> handler) {
            requireNonNull(commandType, "No commandType provided");
            requireNonNull(handler, "No handler provided");
            if (handlers.containsKey(commandType)) {
                throw new IllegalArgumentException(msg("A CommandHandler for '{}' has already been added", commandType.getName()));
            }
            handlers.put(commandType, handler);
            return this;
        }

        public CommandPipeline build() {
            var chains = new LinkedHashMap<Class<?>, CommandMiddleware.NextCommandHandler>();
            handlers.forEach((commandType, handler) -> {
                CommandMiddleware.NextCommandHandler chain = new HandlerInvocation(commandType, handler);
                for (int index = middlewares.size() - 1; index >= 0; index--) {
                    chain = new MiddlewareInvocation(middlewares.get(index), chain);
                }
                chains.put(commandType, chain);
            });
            return new DefaultCommandPipeline(chains, middlewares.size());
        }
    }

    class DefaultCommandPipeline implements CommandPipeline {
        private static final Logger log = LoggerFactory.getLogger(CommandPipeline.class);

        private final Map<Class<?>, CommandMiddleware.NextCommandHandler> chains;

        private DefaultCommandPipeline(Map<Class<?>, CommandMiddleware.NextCommandHandler> chains, int numberOfMiddlewares) {
            this.chains = Map.copyOf(chains);
            log.debug("Composed command chains for {} command type(s) with {} middleware(s)", chains.size(), numberOfMiddlewares);
        }

        @Override
        public <R> OperationResult<R> send(Command<R> command) {
            requireNonNull(command, "No command provided");
            return resolveChain(command.getClass()).handle(command);
        }

        private CommandMiddleware.NextCommandHandler resolveChain(Class<?> commandType) {
            var chain = chains.get(commandType);
            if (chain != null) {
                return chain;
            }
            for (Map.Entry<Class<?>, CommandMiddleware.NextCommandHandler> entry : chains.entrySet()) {
                if (entry.getKey().isAssignableFrom(commandType)) {
                    return entry.getValue();
                }
            }
            throw new CommandHandlerNotFoundException(commandType);
        }
    }

    final class MiddlewareInvocation implements CommandMiddleware.NextCommandHandler {
        private final CommandMiddleware                    middleware;
        private final CommandMiddleware.NextCommandHandler next;

        MiddlewareInvocation(CommandMiddleware middleware, CommandMiddleware.NextCommandHandler next) {
            this.middleware = middleware;
            this.next = next;
        }

        @Override
        public <R> OperationResult<R> handle(Command<R> command) {
            return middleware.intercept(command, next);
        }
    }

    final class HandlerInvocation implements CommandMiddleware.NextCommandHandler {
        private final Class<?>             commandType;
        private final CommandHandler<?, ?> handler;

        HandlerInvocation(Class<?> commandType, CommandHandler<?, ?> handler) {
            this.commandType = commandType;
            this.handler = handler;
        }

        @SuppressWarnings("unchecked")
        @Override
        public <R> OperationResult<R> handle(Command<R> command) {
            var result = ((CommandHandler<Command<R>, R>) handler).handle(command);
            if (result == null) {
                throw new CommandException(msg("CommandHandler '{}' for '{}' returned a null result", handler.getClass().getName(), commandType.getName()));
            }
            return result;
        }
    }
}
