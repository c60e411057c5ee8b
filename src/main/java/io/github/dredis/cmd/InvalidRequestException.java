package io.github.dredis.cmd;

/**
 * 请求不是bulk string数组，或者参数不合法（null bulk string、空key）。
 */
public class InvalidRequestException extends CommandException {
    private static final long serialVersionUID = 2286372581394003785L;

    public InvalidRequestException(String command, String message) {
        super(command, message);
    }
}
