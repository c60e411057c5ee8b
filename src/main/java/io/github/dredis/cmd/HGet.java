package io.github.dredis.cmd;

import java.util.Optional;

import com.google.common.base.Preconditions;
import io.github.dredis.resp.RespBulkString;
import io.github.dredis.resp.RespData;
import io.github.dredis.store.ByteString;
import io.github.dredis.store.Store;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * HGET key field
 */
@Getter
@EqualsAndHashCode
@ToString
public final class HGet implements Command {
    static final String NAME = "hget";

    private final ByteString key;
    private final ByteString field;

    public HGet(@NonNull ByteString key, @NonNull ByteString field) {
        Preconditions.checkArgument(!key.isEmpty(), "empty key");
        this.key = key;
        this.field = field;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RespData execute(Store store) {
        Optional<ByteString> value = store.hget(key, field);
        return value.isPresent() ? RespBulkString.with(value.get().toByteArray()) : RespBulkString.nullBulkString();
    }
}
