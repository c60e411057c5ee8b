package io.github.dredis.cmd;

import com.google.common.base.Preconditions;
import io.github.dredis.resp.RespData;
import io.github.dredis.resp.RespInteger;
import io.github.dredis.store.ByteString;
import io.github.dredis.store.Store;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * HSET key field value，新建field返回1，覆盖已有field返回0。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class HSet implements Command {
    static final String NAME = "hset";

    private final ByteString key;
    private final ByteString field;
    private final ByteString value;

    public HSet(@NonNull ByteString key, @NonNull ByteString field, @NonNull ByteString value) {
        Preconditions.checkArgument(!key.isEmpty(), "empty key");
        this.key = key;
        this.field = field;
        this.value = value;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RespData execute(Store store) {
        boolean existed = store.hset(key, field, value);
        return RespInteger.with(!existed);
    }
}
