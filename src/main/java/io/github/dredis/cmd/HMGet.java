package io.github.dredis.cmd;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.dredis.resp.RespArray;
import io.github.dredis.resp.RespBulkString;
import io.github.dredis.resp.RespData;
import io.github.dredis.store.ByteString;
import io.github.dredis.store.Store;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * HMGET key field [field ...]，按请求顺序返回，不存在的field为null bulk string。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class HMGet implements Command {
    static final String NAME = "hmget";

    private final ByteString       key;
    private final List<ByteString> fields;

    public HMGet(@NonNull ByteString key, @NonNull List<ByteString> fields) {
        Preconditions.checkArgument(!key.isEmpty(), "empty key");
        Preconditions.checkArgument(!fields.isEmpty(), "hmget requires at least one field");
        this.key = key;
        this.fields = ImmutableList.copyOf(fields);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RespData execute(Store store) {
        List<Optional<ByteString>> values = store.hmget(key, fields);
        List<RespData> datas = new ArrayList<>(values.size());
        for (Optional<ByteString> value : values) {
            datas.add(value.isPresent() ? RespBulkString.with(value.get().toByteArray()) : RespBulkString.nullBulkString());
        }
        return RespArray.with(datas);
    }
}
