package io.github.dredis.cmd;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import io.github.dredis.resp.RespArray;
import io.github.dredis.resp.RespBulkString;
import io.github.dredis.resp.RespData;
import io.github.dredis.store.ByteString;

/**
 * 把解码后的请求转换为{@link Command}。
 * <p>
 * 请求必须是非空的bulk string数组，第一个元素是命令名（不区分大小写），其余是参数。
 * 参数个数、null参数和空key都在这里校验，校验通过才会构造命令。
 * </p>
 */
public final class CommandParser {

    private CommandParser() {
    }

    /**
     * @param request 解码后的请求
     * @return 命令
     * @throws UnknownCommandException 不支持的命令
     * @throws WrongArityException 参数个数不对
     * @throws InvalidRequestException 请求格式或参数不合法
     */
    public static Command parse(RespData request) throws CommandException {
        if (!(request instanceof RespArray) || ((RespArray) request).isNull()) {
            throw new InvalidRequestException("", "ERR Protocol error: expected an array of bulk strings");
        }
        RespArray array = (RespArray) request;
        if (array.size() == 0) {
            throw new InvalidRequestException("", "ERR Protocol error: empty command");
        }

        List<ByteString> args = new ArrayList<>(array.size());
        for (RespData data : array.getDatas()) {
            if (!(data instanceof RespBulkString) || ((RespBulkString) data).isNull()) {
                throw new InvalidRequestException("", "ERR Protocol error: expected bulk string arguments");
            }
            args.add(ByteString.copyFrom(((RespBulkString) data).getContent()));
        }

        String name = args.get(0).toStringUtf8();
        List<ByteString> params = args.subList(1, args.size());
        switch (name.toLowerCase(Locale.ROOT)) {
            case Get.NAME:
                checkArity(Get.NAME, params, 1, false);
                return new Get(key(Get.NAME, params));
            case Set.NAME:
                checkArity(Set.NAME, params, 2, false);
                return new Set(key(Set.NAME, params), params.get(1));
            case HSet.NAME:
                checkArity(HSet.NAME, params, 3, false);
                return new HSet(key(HSet.NAME, params), params.get(1), params.get(2));
            case HGet.NAME:
                checkArity(HGet.NAME, params, 2, false);
                return new HGet(key(HGet.NAME, params), params.get(1));
            case HMGet.NAME:
                checkArity(HMGet.NAME, params, 2, true);
                return new HMGet(key(HMGet.NAME, params), params.subList(1, params.size()));
            case HGetAll.NAME:
                checkArity(HGetAll.NAME, params, 1, false);
                return new HGetAll(key(HGetAll.NAME, params));
            case Echo.NAME:
                checkArity(Echo.NAME, params, 1, false);
                return new Echo(params.get(0));
            case SAdd.NAME:
                checkArity(SAdd.NAME, params, 2, true);
                return new SAdd(key(SAdd.NAME, params), params.subList(1, params.size()));
            case SIsMember.NAME:
                checkArity(SIsMember.NAME, params, 2, false);
                return new SIsMember(key(SIsMember.NAME, params), params.get(1));
            default:
                throw new UnknownCommandException(name);
        }
    }

    /**
     * @param n 参数个数，atLeast为true时表示最少个数
     */
    private static void checkArity(String command, List<ByteString> params, int n, boolean atLeast)
            throws WrongArityException {
        if (atLeast ? params.size() < n : params.size() != n) {
            throw new WrongArityException(command);
        }
    }

    private static ByteString key(String command, List<ByteString> params) throws InvalidRequestException {
        ByteString key = params.get(0);
        if (key.isEmpty()) {
            throw new InvalidRequestException(command, "ERR invalid empty key for '" + command + "' command");
        }
        return key;
    }
}
