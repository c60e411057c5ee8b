package io.github.dredis.resp;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * resp3的double类型，无穷大和NaN写作inf、-inf、nan。
 */
@EqualsAndHashCode
@ToString
public final class RespDouble implements RespData {
    public static final char firstChar = ',';

    @Getter
    private final double value;

    public static RespDouble with(double value) {
        return new RespDouble(value);
    }

    private RespDouble(double value) {
        this.value = value;
    }

    @Override
    public byte[] toBytes() {
        return (firstChar + format(value) + "\r\n").getBytes(StandardCharsets.US_ASCII);
    }

    static String format(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        return Double.toString(d);
    }
}
