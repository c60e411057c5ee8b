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
 * SISMEMBER key member，返回1或0。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SIsMember implements Command {
    static final String NAME = "sismember";

    private final ByteString key;
    private final ByteString member;

    public SIsMember(@NonNull ByteString key, @NonNull ByteString member) {
        Preconditions.checkArgument(!key.isEmpty(), "empty key");
        this.key = key;
        this.member = member;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RespData execute(Store store) {
        return RespInteger.with(store.sismember(key, member));
    }
}
