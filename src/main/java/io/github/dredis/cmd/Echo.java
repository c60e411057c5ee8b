package io.github.dredis.cmd;

import io.github.dredis.resp.RespBulkString;
import io.github.dredis.resp.RespData;
import io.github.dredis.store.ByteString;
import io.github.dredis.store.Store;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * ECHO message，不访问store。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Echo implements Command {
    static final String NAME = "echo";

    private final ByteString message;

    public Echo(@NonNull ByteString message) {
        this.message = message;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RespData execute(Store store) {
        return RespBulkString.with(message.toByteArray());
    }
}
