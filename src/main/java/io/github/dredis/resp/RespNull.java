package io.github.dredis.resp;

import java.nio.charset.StandardCharsets;

/**
 * resp3的null类型（_\r\n）。
 */
public final class RespNull implements RespData {
    public static final char firstChar = '_';

    private static final RespNull INSTANCE = new RespNull();
    private static final byte[]   BYTES    = "_\r\n".getBytes(StandardCharsets.US_ASCII);

    public static RespNull instance() {
        return INSTANCE;
    }

    private RespNull() {
    }

    @Override
    public byte[] toBytes() {
        return BYTES.clone();
    }

    @Override
    public String toString() {
        return "RespNull";
    }
}
