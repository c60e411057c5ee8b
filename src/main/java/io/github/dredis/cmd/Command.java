package io.github.dredis.cmd;

import io.github.dredis.resp.RespData;
import io.github.dredis.store.Store;

/**
 * 经过校验的请求命令。每种命令知道如何在{@link Store}上执行自己并生成一个响应。
 * <p>
 * 命令的种类是固定的，新增命令需要增加一个实现类并在{@link CommandParser}中解析，没有运行时注册。
 * </p>
 */
public interface Command {

    /**
     * @return 小写的命令名
     */
    String getName();

    /**
     * @param store 共享存储
     * @return 响应
     * @throws io.github.dredis.store.WrongTypeException key的值类型与命令不符
     */
    RespData execute(Store store);
}
