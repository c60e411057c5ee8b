package io.github.dredis.cmd;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
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
 * HGETALL key，返回field、value交替的数组，顺序为field的插入顺序。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class HGetAll implements Command {
    static final String NAME = "hgetall";

    private final ByteString key;

    public HGetAll(@NonNull ByteString key) {
        Preconditions.checkArgument(!key.isEmpty(), "empty key");
        this.key = key;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RespData execute(Store store) {
        List<Map.Entry<ByteString, ByteString>> entries = store.hgetall(key);
        List<RespData> datas = new ArrayList<>(entries.size() * 2);
        for (Map.Entry<ByteString, ByteString> entry : entries) {
            datas.add(RespBulkString.with(entry.getKey().toByteArray()));
            datas.add(RespBulkString.with(entry.getValue().toByteArray()));
        }
        return RespArray.with(datas);
    }
}
