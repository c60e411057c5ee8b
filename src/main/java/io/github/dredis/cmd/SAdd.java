package io.github.dredis.cmd;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.dredis.resp.RespData;
import io.github.dredis.resp.RespInteger;
import io.github.dredis.store.ByteString;
import io.github.dredis.store.Store;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * SADD key member [member ...]，返回新加入的member个数。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SAdd implements Command {
    static final String NAME = "sadd";

    private final ByteString       key;
    private final List<ByteString> members;

    public SAdd(@NonNull ByteString key, @NonNull List<ByteString> members) {
        Preconditions.checkArgument(!key.isEmpty(), "empty key");
        Preconditions.checkArgument(!members.isEmpty(), "sadd requires at least one member");
        this.key = key;
        this.members = ImmutableList.copyOf(members);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RespData execute(Store store) {
        return RespInteger.with(store.sadd(key, members));
    }
}
