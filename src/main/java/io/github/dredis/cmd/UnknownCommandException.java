package io.github.dredis.cmd;

public class UnknownCommandException extends CommandException {
    private static final long serialVersionUID = 6061541926345208816L;

    public UnknownCommandException(String command) {
        // 命令名来自客户端，错误响应里不能出现换行
        super(command, "ERR unknown command '" + command.replace('\r', ' ').replace('\n', ' ') + "'");
    }
}
