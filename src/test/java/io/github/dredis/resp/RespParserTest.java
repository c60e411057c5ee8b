package io.github.dredis.resp;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespParserTest {
    private static final List<RespData> FRAMES = Arrays.asList(
            RespSimpleString.withUTF8("OK"),
            RespError.withUTF8("WRONGTYPE Operation against a key holding the wrong kind of value"),
            RespInteger.with(Long.MIN_VALUE),
            RespBulkString.withUTF8("Hello, World!"),
            RespBulkString.with(new byte[]{0, '\r', '\n', (byte) 0xff}),
            RespBulkString.with(new byte[0]),
            RespBulkString.nullBulkString(),
            RespArray.empty(),
            RespArray.nullArray(),
            RespNull.instance(),
            RespBoolean.with(true),
            RespDouble.with(-3.25),
            RespMap.empty(),
            RespSet.empty(),
            RespMap.with(ImmutableMap.of(
                    RespSimpleString.withUTF8("first"), RespInteger.with(1),
                    RespBulkString.withUTF8("second"), RespArray.with(RespBulkString.withUTF8("x"), RespNull.instance()))),
            RespSet.with(RespDouble.with(1.5), RespBulkString.withUTF8("member"),
                    RespSet.with(RespBoolean.with(true)), RespMap.with(ImmutableMap.of(RespInteger.with(7), RespBoolean.with(false)))),
            RespArray.with(RespSimpleString.withUTF8("hi"), RespBulkString.withUTF8("cookies"),
                    RespArray.with(RespSimpleString.withUTF8("nest element"), RespArray.empty(), RespInteger.with(233)),
                    RespArray.nullArray(), RespBulkString.nullBulkString()));

    @Test
    void decodeWhatWasEncoded() {
        for (RespData frame : FRAMES) {
            byte[] bytes = frame.toBytes();
            ByteBuf buf = ByteBuf.allocate(8).writeBytes(bytes);

            RespParser.Parsed parsed = RespParser.parse(buf);

            assertNotNull(parsed, frame.toString());
            assertEquals(frame, parsed.getData());
            assertEquals(bytes.length, parsed.getConsumed());
            assertEquals(0, buf.readableBytes());
        }
    }

    @Test
    void strictPrefixIsIncomplete() {
        for (RespData frame : FRAMES) {
            byte[] bytes = frame.toBytes();
            for (int len = 0; len < bytes.length; len++) {
                ByteBuf buf = ByteBuf.allocate(8).writeBytes(Arrays.copyOf(bytes, len));

                assertNull(RespParser.parse(buf), frame + " prefix " + len);
                assertEquals(0, buf.getReaderIndex());
            }
        }
    }

    @Test
    void consumesOnlyTheFirstFrame() {
        ByteBuf buf = ByteBuf.allocate(64).writeBytes("+OK\r\n:12\r\n$3\r\nfo".getBytes());

        RespParser.Parsed first = RespParser.parse(buf);
        assertEquals(RespSimpleString.ok(), first.getData());
        assertEquals(5, first.getConsumed());

        RespParser.Parsed second = RespParser.parse(buf);
        assertEquals(RespInteger.with(12), second.getData());
        assertEquals(5, second.getConsumed());

        assertNull(RespParser.parse(buf));
        assertEquals(6, buf.readableBytes());
    }

    @Test
    void resp3Scalars() {
        assertEquals(RespDouble.with(Double.POSITIVE_INFINITY), parse(",inf\r\n"));
        assertEquals(RespDouble.with(1e10), parse(",1e10\r\n"));
        assertTrue(Double.isNaN(((RespDouble) parse(",nan\r\n")).getValue()));
        assertEquals(RespBoolean.with(false), parse("#f\r\n"));
        assertSame(RespNull.instance(), parse("_\r\n"));
    }

    @Test
    void resp3Aggregates() {
        RespMap map = (RespMap) parse("%2\r\n+a\r\n:1\r\n$1\r\nb\r\n*0\r\n");
        assertEquals(2, map.size());
        assertEquals(RespInteger.with(1), map.get(RespSimpleString.withUTF8("a")));
        assertEquals(RespArray.empty(), map.get(RespBulkString.withUTF8("b")));

        RespSet set = (RespSet) parse("~3\r\n:1\r\n:2\r\n+1\r\n");
        assertEquals(3, set.size());
        assertTrue(set.contains(RespSimpleString.withUTF8("1")));
        assertFalse(set.contains(RespInteger.with(3)));
    }

    @Test
    void invalidResp3Aggregates() {
        assertProtocolError("%-1\r\n");
        assertProtocolError("~-1\r\n");
        assertProtocolError("%x\r\n");
        assertProtocolError("%" + (RespParser.MAX_ARRAY_LENGTH + 1) + "\r\n");
        assertProtocolError("%2\r\n+a\r\n:1\r\n+a\r\n:2\r\n");
        assertProtocolError("~2\r\n:1\r\n:1\r\n");

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i <= RespParser.MAX_DEPTH; i++) {
            sb.append(i % 2 == 0 ? "~1\r\n" : "%1\r\n+k\r\n");
        }
        assertProtocolError(sb.toString());
    }

    @Test
    void integerAcceptsPlusSign() {
        assertEquals(RespInteger.with(5), parse(":+5\r\n"));
    }

    @Test
    void unknownType() {
        assertProtocolError("?what\r\n");
        assertProtocolError("GET key\r\n");
    }

    @Test
    void nonNumericLength() {
        assertProtocolError("$abc\r\n");
        assertProtocolError("*1x\r\n");
        assertProtocolError("$\r\n");
        assertProtocolError(":12a\r\n");
        assertProtocolError(":-\r\n");
    }

    @Test
    void lengthOutOfRange() {
        assertProtocolError("$-2\r\n");
        assertProtocolError("*-5\r\n");
        assertProtocolError("$" + (RespParser.MAX_BULK_LENGTH + 1) + "\r\n");
        assertProtocolError("*" + (RespParser.MAX_ARRAY_LENGTH + 1) + "\r\n");
        assertProtocolError(":9223372036854775808\r\n");
    }

    @Test
    void bulkStringWithoutTerminator() {
        assertProtocolError("$3\r\nfooXY");
    }

    @Test
    void bareCarriageReturn() {
        assertProtocolError("+OK\rX\n");
    }

    @Test
    void lineFeedInsideLine() {
        assertProtocolError("+a\nb\r\n");
        assertProtocolError("-e\nx\r\n");
        assertProtocolError(":1\n2\r\n");
        assertProtocolError("$3\n\r\nfoo\r\n");
        assertProtocolError("+a\nb");
        assertProtocolError("*1\r\n+a\nb\r\n");
    }

    @Test
    void lineTooLong() {
        byte[] bytes = new byte[RespParser.MAX_LINE_LENGTH + 2];
        Arrays.fill(bytes, (byte) 'a');
        bytes[0] = '+';
        assertThrows(RespProtocolException.class, () -> RespParser.parse(ByteBuf.allocate(16).writeBytes(bytes)));
    }

    @Test
    void nestingTooDeep() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i <= RespParser.MAX_DEPTH; i++) {
            sb.append("*1\r\n");
        }
        assertProtocolError(sb.toString());
    }

    @Test
    void invalidResp3Scalars() {
        assertProtocolError("#x\r\n");
        assertProtocolError(",1.2.3\r\n");
        assertProtocolError(",Infinity\r\n");
        assertProtocolError("_x\r\n");
    }

    private static RespData parse(String s) {
        RespParser.Parsed parsed = RespParser.parse(ByteBuf.allocate(16).writeBytes(s.getBytes()));
        assertNotNull(parsed);
        return parsed.getData();
    }

    private static void assertProtocolError(String s) {
        ByteBuf buf = ByteBuf.allocate(16).writeBytes(s.getBytes());
        assertThrows(RespProtocolException.class, () -> RespParser.parse(buf), s);
    }
}
