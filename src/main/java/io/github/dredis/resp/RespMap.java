package io.github.dredis.resp;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * resp3的map类型：%后跟entry个数，然后依次是每个entry的key和value。
 * key和value可以是任意resp类型，保持写入顺序，key不能重复。
 */
@EqualsAndHashCode
@ToString
public final class RespMap implements RespData {
    public static final char firstChar = '%';

    private static final RespMap EMPTY = new RespMap(ImmutableMap.of());

    @Getter
    private final ImmutableMap<RespData, RespData> entries;

    public static RespMap empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException entries中有相等的key
     */
    public static RespMap with(@NonNull Map<? extends RespData, ? extends RespData> entries) {
        return new RespMap(ImmutableMap.copyOf(entries));
    }

    private RespMap(ImmutableMap<RespData, RespData> entries) {
        this.entries = entries;
    }

    public int size() {
        return entries.size();
    }

    public RespData get(RespData key) {
        return entries.get(key);
    }

    @Override
    public byte[] toBytes() {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        os.writeBytes((firstChar + Integer.toString(entries.size()) + "\r\n").getBytes(StandardCharsets.US_ASCII));
        for (Map.Entry<RespData, RespData> entry : entries.entrySet()) {
            os.writeBytes(entry.getKey().toBytes());
            os.writeBytes(entry.getValue().toBytes());
        }
        return os.toByteArray();
    }
}
