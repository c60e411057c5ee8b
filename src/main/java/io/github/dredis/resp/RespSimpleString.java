package io.github.dredis.resp;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespSimpleString extends RespString {
    public static final char firstChar = '+';

    private static final RespSimpleString OK = withUTF8("OK");

    public static RespSimpleString withUTF8(String content) {
        return new RespSimpleString(content);
    }

    public static RespSimpleString ok() {
        return OK;
    }

    public RespSimpleString(String content) {
        super(content);
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
