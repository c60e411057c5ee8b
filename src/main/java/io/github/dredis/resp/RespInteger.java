package io.github.dredis.resp;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 有符号64位整数。
 */
@EqualsAndHashCode
@ToString
public class RespInteger implements RespData {
    public static final char firstChar = ':';

    private static final RespInteger ZERO = new RespInteger(0);
    private static final RespInteger ONE  = new RespInteger(1);

    @Getter
    private final long n;

    public static RespInteger with(long n) {
        if (n == 0) {
            return ZERO;
        }
        if (n == 1) {
            return ONE;
        }
        return new RespInteger(n);
    }

    public static RespInteger with(boolean b) {
        return b ? ONE : ZERO;
    }

    private RespInteger(long n) {
        this.n = n;
    }

    @Override
    public byte[] toBytes() {
        return (firstChar + Long.toString(n) + "\r\n").getBytes(StandardCharsets.US_ASCII);
    }
}
