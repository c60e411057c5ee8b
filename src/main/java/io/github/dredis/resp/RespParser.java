package io.github.dredis.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.ToString;

/**
 * 从{@link ByteBuf}的可读数据中解析一个完整的resp数据。
 * <p>
 * 解析只使用绝对索引，数据不完整时返回null且不移动读位置；
 * 解析成功后读位置前进consumed个字节。下次收到更多数据后从头重新解析即可。
 * 数据格式错误时抛出{@link RespProtocolException}。
 * </p>
 */
public final class RespParser {
    static final int MAX_BULK_LENGTH  = 512 * 1024 * 1024;
    static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    static final int MAX_LINE_LENGTH  = 64 * 1024;
    static final int MAX_DEPTH        = 128;

    private static final Pattern DOUBLE = Pattern.compile("[+-]?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    /**
     * 解析结果：数据和它占用的字节数。
     */
    @Getter
    @ToString
    public static final class Parsed {
        private final RespData data;
        private final int      consumed;

        Parsed(RespData data, int consumed) {
            this.data = data;
            this.consumed = consumed;
        }
    }

    private final ByteBuf buf;
    private       int     cursor;

    private RespParser(ByteBuf buf) {
        this.buf = buf;
        this.cursor = buf.getReaderIndex();
    }

    /**
     * @param buf 待解析数据
     * @return 解析结果，数据不完整时返回null
     * @throws RespProtocolException 数据格式错误
     */
    public static Parsed parse(ByteBuf buf) {
        RespParser parser = new RespParser(buf);
        RespData data = parser.parseData(0);
        if (data == null) {
            return null;
        }
        int consumed = parser.cursor - buf.getReaderIndex();
        buf.skipBytes(consumed);
        return new Parsed(data, consumed);
    }

    private RespData parseData(int depth) {
        if (cursor >= buf.getWriterIndex()) {
            return null;
        }
        char type = (char) buf.getByte(cursor);
        cursor++;
        switch (type) {
            case RespSimpleString.firstChar: {
                String line = readLine();
                return line == null ? null : RespSimpleString.withUTF8(line);
            }
            case RespError.firstChar: {
                String line = readLine();
                return line == null ? null : RespError.withUTF8(line);
            }
            case RespInteger.firstChar: {
                String line = readLine();
                return line == null ? null : RespInteger.with(parseLong(line, "integer"));
            }
            case RespBulkString.firstChar:
                return parseBulkString();
            case RespArray.firstChar:
                return parseArray(depth);
            case RespMap.firstChar:
                return parseMap(depth);
            case RespSet.firstChar:
                return parseSet(depth);
            case RespNull.firstChar: {
                String line = readLine();
                if (line == null) {
                    return null;
                }
                if (!line.isEmpty()) {
                    throw new RespProtocolException("invalid null: " + line);
                }
                return RespNull.instance();
            }
            case RespBoolean.firstChar:
                return parseBoolean();
            case RespDouble.firstChar:
                return parseDouble();
            default:
                throw new RespProtocolException("unknown resp type: " + printable(type));
        }
    }

    private RespBulkString parseBulkString() {
        String line = readLine();
        if (line == null) {
            return null;
        }
        int len = parseLength(line, MAX_BULK_LENGTH, "bulk string");
        if (len == -1) {
            return RespBulkString.nullBulkString();
        }
        if ((long) buf.getWriterIndex() - cursor < (long) len + 2) {
            return null;
        }
        byte[] content = new byte[len];
        buf.getBytes(cursor, content);
        cursor += len;
        if (buf.getByte(cursor) != '\r' || buf.getByte(cursor + 1) != '\n') {
            throw new RespProtocolException("bulk string is not terminated by CRLF");
        }
        cursor += 2;
        return RespBulkString.with(content);
    }

    private RespArray parseArray(int depth) {
        String line = readLine();
        if (line == null) {
            return null;
        }
        int len = parseLength(line, MAX_ARRAY_LENGTH, "array");
        if (len == -1) {
            return RespArray.nullArray();
        }
        if (len == 0) {
            return RespArray.empty();
        }
        if (depth >= MAX_DEPTH) {
            throw new RespProtocolException("array nesting is too deep");
        }
        List<RespData> datas = new ArrayList<>(Math.min(len, 1024));
        for (int i = 0; i < len; i++) {
            RespData data = parseData(depth + 1);
            if (data == null) {
                return null;
            }
            datas.add(data);
        }
        return RespArray.with(datas);
    }

    private RespMap parseMap(int depth) {
        String line = readLine();
        if (line == null) {
            return null;
        }
        int len = parseAggregateLength(line, "map");
        if (len == 0) {
            return RespMap.empty();
        }
        if (depth >= MAX_DEPTH) {
            throw new RespProtocolException("map nesting is too deep");
        }
        Map<RespData, RespData> entries = new LinkedHashMap<>();
        for (int i = 0; i < len; i++) {
            RespData key = parseData(depth + 1);
            if (key == null) {
                return null;
            }
            RespData value = parseData(depth + 1);
            if (value == null) {
                return null;
            }
            if (entries.put(key, value) != null) {
                throw new RespProtocolException("duplicate map key: " + key);
            }
        }
        return RespMap.with(entries);
    }

    private RespSet parseSet(int depth) {
        String line = readLine();
        if (line == null) {
            return null;
        }
        int len = parseAggregateLength(line, "set");
        if (len == 0) {
            return RespSet.empty();
        }
        if (depth >= MAX_DEPTH) {
            throw new RespProtocolException("set nesting is too deep");
        }
        Set<RespData> datas = new LinkedHashSet<>();
        for (int i = 0; i < len; i++) {
            RespData data = parseData(depth + 1);
            if (data == null) {
                return null;
            }
            if (!datas.add(data)) {
                throw new RespProtocolException("duplicate set element: " + data);
            }
        }
        return RespSet.with(datas);
    }

    private RespBoolean parseBoolean() {
        String line = readLine();
        if (line == null) {
            return null;
        }
        switch (line) {
            case "t":
                return RespBoolean.with(true);
            case "f":
                return RespBoolean.with(false);
            default:
                throw new RespProtocolException("invalid boolean: " + line);
        }
    }

    private RespDouble parseDouble() {
        String line = readLine();
        if (line == null) {
            return null;
        }
        switch (line.toLowerCase()) {
            case "inf":
            case "+inf":
                return RespDouble.with(Double.POSITIVE_INFINITY);
            case "-inf":
                return RespDouble.with(Double.NEGATIVE_INFINITY);
            case "nan":
                return RespDouble.with(Double.NaN);
            default:
                if (!DOUBLE.matcher(line).matches()) {
                    throw new RespProtocolException("invalid double: " + line);
                }
                return RespDouble.with(Double.parseDouble(line));
        }
    }

    /**
     * 读取从cursor开始到CRLF的一行，cursor移到CRLF之后。
     * @return 行内容，没有找到完整的CRLF返回null
     */
    private String readLine() {
        int end = buf.getWriterIndex();
        int cr = buf.indexOf(cursor, end, (byte) '\r');
        if (buf.indexOf(cursor, cr == -1 ? end : cr, (byte) '\n') != -1) {
            throw new RespProtocolException("unexpected \\n in line");
        }
        if (cr == -1) {
            if (end - cursor > MAX_LINE_LENGTH) {
                throw new RespProtocolException("line is too long");
            }
            return null;
        }
        if (cr - cursor > MAX_LINE_LENGTH) {
            throw new RespProtocolException("line is too long");
        }
        if (cr + 1 >= end) {
            return null;
        }
        if (buf.getByte(cr + 1) != '\n') {
            throw new RespProtocolException("expect \\n after \\r");
        }
        byte[] bytes = new byte[cr - cursor];
        buf.getBytes(cursor, bytes);
        cursor = cr + 2;
        return new String(bytes, StandardCharsets.UTF_8);
    }

    // map和set没有null形式
    private static int parseAggregateLength(String line, String type) {
        int len = parseLength(line, MAX_ARRAY_LENGTH, type);
        if (len == -1) {
            throw new RespProtocolException("invalid " + type + " length: " + line);
        }
        return len;
    }

    private static int parseLength(String line, int max, String type) {
        long len = parseLong(line, type + " length");
        if (len < -1 || len > max) {
            throw new RespProtocolException("invalid " + type + " length: " + line);
        }
        return (int) len;
    }

    private static long parseLong(String line, String what) {
        int i = 0;
        boolean negative = false;
        if (!line.isEmpty() && (line.charAt(0) == '-' || line.charAt(0) == '+')) {
            negative = line.charAt(0) == '-';
            i++;
        }
        if (i == line.length()) {
            throw new RespProtocolException("invalid " + what + ": '" + line + "'");
        }
        long n = 0;
        for (; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c < '0' || c > '9') {
                throw new RespProtocolException("invalid " + what + ": '" + line + "'");
            }
            // 以负数累加，Long.MIN_VALUE也能表示
            long next = n * 10 - (c - '0');
            if (n < Long.MIN_VALUE / 10 || next > n) {
                throw new RespProtocolException(what + " overflow: " + line);
            }
            n = next;
        }
        if (negative) {
            return n;
        }
        if (n == Long.MIN_VALUE) {
            throw new RespProtocolException(what + " overflow: " + line);
        }
        return -n;
    }

    private static String printable(char c) {
        return c >= 0x20 && c < 0x7f ? "'" + c + "'" : String.format("0x%02x", (int) c & 0xff);
    }
}
