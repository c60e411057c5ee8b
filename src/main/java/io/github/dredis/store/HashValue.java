package io.github.dredis.store;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * field到value的映射，保持field的插入顺序。
 */
@EqualsAndHashCode(callSuper = false)
@ToString
public final class HashValue extends Value {
    private final Map<ByteString, ByteString> fields;

    HashValue() {
        this.fields = new LinkedHashMap<>();
    }

    private HashValue(ImmutableMap<ByteString, ByteString> fields) {
        this.fields = fields;
    }

    @Override
    public ValueType getType() {
        return ValueType.HASH;
    }

    public Map<ByteString, ByteString> getFields() {
        return ImmutableMap.copyOf(fields);
    }

    ByteString get(ByteString field) {
        return fields.get(field);
    }

    /**
     * @return field是否已经存在
     */
    boolean put(ByteString field, ByteString value) {
        return fields.put(field, value) != null;
    }

    Map<ByteString, ByteString> view() {
        return fields;
    }

    @Override
    Value snapshot() {
        return new HashValue(ImmutableMap.copyOf(fields));
    }
}
