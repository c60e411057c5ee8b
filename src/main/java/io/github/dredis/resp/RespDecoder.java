package io.github.dredis.resp;

import java.nio.ByteBuffer;

/**
 * RESP协议流式解码器，使用自定义的{@link ByteBuf}缓存收到的数据。
 * <p>
 * {@link #decode(ByteBuffer)}只缓存数据，{@link #get()}每次从缓存中解析出下一个完整的数据，
 * 一次读到的多个请求（pipeline）可以连续取出。不完整的数据留在缓存中等待后续字节，
 * 此时{@link #get()}返回null并回收已经解析过的字节。
 * 一个连接使用一个解码器，非线程安全。
 * </p>
 */
public class RespDecoder {
    private final ByteBuf byteBuf;

    public static RespDecoder create() {
        return new RespDecoder(512);
    }

    public static RespDecoder create(int initialCapacity) {
        return new RespDecoder(initialCapacity);
    }

    private RespDecoder(int initialCapacity) {
        byteBuf = ByteBuf.allocate(initialCapacity);
    }

    public RespDecoder decode(byte[] bytes) {
        byteBuf.writeBytes(bytes);
        return this;
    }

    public RespDecoder decode(ByteBuffer buf) {
        byteBuf.writeBytes(buf);
        return this;
    }

    /**
     * 解析下一个完整的数据。
     * @return 数据，缓存中没有完整的数据时返回null
     * @throws RespProtocolException 数据格式错误，之后解码器不能再使用
     */
    @SuppressWarnings("unchecked")
    public <T extends RespData> T get() {
        RespParser.Parsed parsed = RespParser.parse(byteBuf);
        if (parsed == null) {
            byteBuf.discardReadBytes();
            return null;
        }
        return (T) parsed.getData();
    }

    /**
     * @return 缓存中还未取出的字节数
     */
    public int bufferedBytes() {
        return byteBuf.readableBytes();
    }
}
