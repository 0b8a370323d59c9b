package dk.cloudcreate.essentials.statebased.command;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class CommandHandlerNotFoundException extends CommandException {
    public final Class<?> commandType;

    public CommandHandlerNotFoundException(Class<?> commandType) {
        super(msg("No CommandHandler registered for command type '{}'", commandType.getName()));
        this.commandType = commandType;
    }
}
