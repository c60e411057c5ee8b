package io.github.dredis.store;

/**
 * key对应的值的种类，名称与redis TYPE命令的返回值一致。
 */
public enum ValueType {
    STRING("string"),
    HASH("hash"),
    SET("set");

    private final String name;

    ValueType(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
