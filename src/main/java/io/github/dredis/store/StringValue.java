package io.github.dredis.store;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@EqualsAndHashCode(callSuper = false)
@ToString
public final class StringValue extends Value {
    @Getter
    private final ByteString bytes;

    public StringValue(@NonNull ByteString bytes) {
        this.bytes = bytes;
    }

    @Override
    public ValueType getType() {
        return ValueType.STRING;
    }

    @Override
    Value snapshot() {
        return this;
    }
}
