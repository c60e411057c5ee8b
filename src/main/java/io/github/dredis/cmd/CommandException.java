package io.github.dredis.cmd;

import lombok.Getter;

/**
 * 请求不能转换为命令。message就是返回给客户端的错误内容，连接不需要关闭。
 */
public abstract class CommandException extends Exception {
    private static final long serialVersionUID = -1843001287153436548L;

    @Getter
    private final String command;

    CommandException(String command, String message) {
        super(message);
        this.command = command;
    }
}
