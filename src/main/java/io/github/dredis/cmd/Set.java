package io.github.dredis.cmd;

import com.google.common.base.Preconditions;
import io.github.dredis.resp.RespData;
import io.github.dredis.resp.RespSimpleString;
import io.github.dredis.store.ByteString;
import io.github.dredis.store.Store;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * SET key value，覆盖key原有的任何值。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Set implements Command {
    static final String NAME = "set";

    private final ByteString key;
    private final ByteString value;

    public Set(@NonNull ByteString key, @NonNull ByteString value) {
        Preconditions.checkArgument(!key.isEmpty(), "empty key");
        this.key = key;
        this.value = value;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RespData execute(Store store) {
        store.set(key, value);
        return RespSimpleString.ok();
    }
}
