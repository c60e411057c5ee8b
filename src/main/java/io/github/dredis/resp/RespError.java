package io.github.dredis.resp;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 错误响应，按redis的习惯内容以错误前缀开头，如"ERR"、"WRONGTYPE"。
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespError extends RespString {
    public static final char firstChar = '-';

    public static RespError withUTF8(String msg) {
        return new RespError(msg);
    }

    public RespError(String content) {
        super(content);
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
