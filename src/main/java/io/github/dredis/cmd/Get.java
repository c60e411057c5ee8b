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
 * GET key
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Get implements Command {
    static final String NAME = "get";

    private final ByteString key;

    public Get(@NonNull ByteString key) {
        Preconditions.checkArgument(!key.isEmpty(), "empty key");
        this.key = key;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RespData execute(Store store) {
        Optional<ByteString> value = store.getString(key);
        if (!value.isPresent()) {
            return RespBulkString.nullBulkString();
        }
        return RespBulkString.with(value.get().toByteArray());
    }
}
