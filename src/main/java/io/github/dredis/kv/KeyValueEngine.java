package io.github.dredis.kv;

import io.github.dredis.cmd.Command;
import io.github.dredis.cmd.CommandException;
import io.github.dredis.cmd.CommandParser;
import io.github.dredis.resp.RespData;
import io.github.dredis.resp.RespError;
import io.github.dredis.store.Store;
import io.github.dredis.store.WrongTypeException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 执行客户端请求：解析为{@link Command}后在共享的{@link Store}上执行。
 * <p>
 * 命令解析失败和值类型不符都转换为错误响应返回给客户端，连接继续可用。
 * 所有连接共用一个engine，engine本身没有状态，线程安全由store保证。
 * </p>
 */
public class KeyValueEngine {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueEngine.class);

    @Getter(AccessLevel.PACKAGE)
    private final Store store;

    @Builder
    public KeyValueEngine(@NonNull Store store) {
        this.store = store;
    }

    /**
     * @param request 解码后的请求
     * @return 响应，总是恰好一个
     */
    public RespData execute(RespData request) {
        Command command;
        try {
            command = CommandParser.parse(request);
        } catch (CommandException e) {
            logger.debug("invalid request {}: {}", request, e.getMessage());
            return RespError.withUTF8(e.getMessage());
        }

        try {
            RespData response = command.execute(store);
            logger.debug("{} -> {}", command, response);
            return response;
        } catch (WrongTypeException e) {
            return RespError.withUTF8(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("execute command {} failed.", command.getName(), e);
            return RespError.withUTF8("ERR internal error executing '" + command.getName() + "'");
        }
    }
}
