package io.github.dredis.resp;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * resp3的boolean类型（#t\r\n或#f\r\n）。
 */
@EqualsAndHashCode
@ToString
public final class RespBoolean implements RespData {
    public static final char firstChar = '#';

    private static final RespBoolean TRUE  = new RespBoolean(true);
    private static final RespBoolean FALSE = new RespBoolean(false);

    @Getter
    private final boolean value;

    public static RespBoolean with(boolean value) {
        return value ? TRUE : FALSE;
    }

    private RespBoolean(boolean value) {
        this.value = value;
    }

    @Override
    public byte[] toBytes() {
        return (value ? "#t\r\n" : "#f\r\n").getBytes(StandardCharsets.US_ASCII);
    }
}
