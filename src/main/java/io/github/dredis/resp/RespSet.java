package io.github.dredis.resp;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;

import com.google.common.collect.ImmutableSet;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * resp3的set类型：~后跟元素个数，然后依次是每个元素。元素保持写入顺序，重复的元素只保留一个。
 */
@EqualsAndHashCode
@ToString
public final class RespSet implements RespData {
    public static final char firstChar = '~';

    private static final RespSet EMPTY = new RespSet(ImmutableSet.of());

    @Getter
    private final ImmutableSet<RespData> datas;

    public static RespSet empty() {
        return EMPTY;
    }

    public static RespSet with(@NonNull Collection<? extends RespData> datas) {
        return new RespSet(ImmutableSet.copyOf(datas));
    }

    public static RespSet with(RespData... datas) {
        return with(Arrays.asList(datas));
    }

    private RespSet(ImmutableSet<RespData> datas) {
        this.datas = datas;
    }

    public int size() {
        return datas.size();
    }

    public boolean contains(RespData data) {
        return datas.contains(data);
    }

    @Override
    public byte[] toBytes() {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        os.writeBytes((firstChar + Integer.toString(datas.size()) + "\r\n").getBytes(StandardCharsets.US_ASCII));
        for (RespData data : datas) {
            os.writeBytes(data.toBytes());
        }
        return os.toByteArray();
    }
}
