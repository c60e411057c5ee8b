package io.github.dredis.cmd;

public class WrongArityException extends CommandException {
    private static final long serialVersionUID = -7785209640219651125L;

    public WrongArityException(String command) {
        super(command, "ERR wrong number of arguments for '" + command + "' command");
    }
}
