package io.github.dredis.resp;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 数组，元素可以是任意resp类型，包括数组。datas为null时表示null array（*-1）。
 */
@EqualsAndHashCode
@ToString
public class RespArray implements RespData {
    public static final char firstChar = '*';

    private static final RespArray EMPTY = new RespArray(Collections.emptyList());
    private static final RespArray NULL  = new RespArray(null);

    private final List<RespData> datas;

    public static RespArray empty() {
        return EMPTY;
    }

    public static RespArray nullArray() {
        return NULL;
    }

    public static RespArray with(List<? extends RespData> datas) {
        return new RespArray(ImmutableList.copyOf(datas));
    }

    public static RespArray with(RespData... datas) {
        return with(Arrays.asList(datas));
    }

    private RespArray(List<RespData> datas) {
        this.datas = datas;
    }

    public boolean isNull() {
        return datas == null;
    }

    public int size() {
        return datas == null ? 0 : datas.size();
    }

    @SuppressWarnings("unchecked")
    public <T extends RespData> T get(int i) {
        Preconditions.checkState(datas != null, "null array has no element");
        return (T) datas.get(i);
    }

    /**
     * @return 所有元素，null array返回空列表
     */
    public List<RespData> getDatas() {
        return datas == null ? Collections.emptyList() : datas;
    }

    @Override
    public byte[] toBytes() {
        int n = datas == null ? -1 : datas.size();
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        os.writeBytes((firstChar + Integer.toString(n) + "\r\n").getBytes(StandardCharsets.US_ASCII));
        for (RespData data : getDatas()) {
            os.writeBytes(data.toBytes());
        }
        return os.toByteArray();
    }
}
