package io.github.dredis.store;

import lombok.Getter;

/**
 * 命令要求的值类型与key当前保存的值类型不一致。
 */
public class WrongTypeException extends RuntimeException {
    private static final long serialVersionUID = 5416270925181347766L;

    @Getter
    private final ValueType expected;
    @Getter
    private final ValueType actual;

    public WrongTypeException(ValueType expected, ValueType actual) {
        super("WRONGTYPE Operation against a key holding the wrong kind of value, expected "
                + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
