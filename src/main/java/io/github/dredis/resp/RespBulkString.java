package io.github.dredis.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 二进制安全的字符串。content为null时表示null bulk string（$-1），与空字符串（$0）不同。
 */
@EqualsAndHashCode
@ToString
public class RespBulkString implements RespData {
    public static final char firstChar = '$';

    private static final RespBulkString NULL = new RespBulkString(null);
    private static final byte[]         CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    @Getter
    private final int    length;
    @Getter
    private final byte[] content;

    public static RespBulkString with(byte[] content) {
        return content == null ? NULL : new RespBulkString(content);
    }

    public static RespBulkString withUTF8(String content) {
        return with(content.getBytes(StandardCharsets.UTF_8));
    }

    public static RespBulkString nullBulkString() {
        return NULL;
    }

    private RespBulkString(byte[] content) {
        this.content = content;
        this.length = content == null ? -1 : content.length;
    }

    public boolean isNull() {
        return content == null;
    }

    @Override
    public byte[] toBytes() {
        byte[] header = (firstChar + Integer.toString(length) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        if (content == null) {
            return header;
        }
        return Bytes.concat(header, content, CRLF);
    }
}
