package io.github.dredis.resp;

import java.nio.ByteBuffer;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import lombok.Getter;

/**
 * jdk自带的{@link ByteBuffer}读写共用一个position，增量解析协议时很不方便。
 * 该类的读写位置是独立的，不用考虑flip和rewind；已读数据可以用{@link #discardReadBytes()}回收。
 */
public class ByteBuf {
    // 底层字节数组
    private byte[] buf;
    // 当前读位置
    @Getter
    private int    readerIndex;
    // 当前写位置
    @Getter
    private int    writerIndex;

    private ByteBuf(int i) {
        Preconditions.checkArgument(i > 0, "capacity must be positive");
        buf = new byte[i];
        readerIndex = 0;
        writerIndex = 0;
    }

    public static ByteBuf allocate(int i) {
        return new ByteBuf(i);
    }

    private int writableBytes() {
        return buf.length - writerIndex;
    }

    /**
     * 把bb中剩余的数据全部写入，bb的position会移动到limit。
     * @param bb 数据源
     * @return 本对象
     */
    public ByteBuf writeBytes(ByteBuffer bb) {
        int n = bb.remaining();
        ensureWritable(n);
        bb.get(buf, writerIndex, n);
        writerIndex += n;
        return this;
    }

    public ByteBuf writeBytes(byte[] bytes) {
        return writeBytes(bytes, 0, bytes.length);
    }

    public ByteBuf writeBytes(byte[] bytes, int offset, int length) {
        Preconditions.checkPositionIndexes(offset, offset + length, bytes.length);
        ensureWritable(length);
        System.arraycopy(bytes, offset, buf, writerIndex, length);
        writerIndex += length;
        return this;
    }

    public int readableBytes() {
        return writerIndex - readerIndex;
    }

    /**
     * 跳过n个可读字节。
     */
    public ByteBuf skipBytes(int n) {
        Preconditions.checkArgument(n >= 0 && n <= readableBytes(), "can not skip %s bytes", n);
        readerIndex += n;
        return this;
    }

    /**
     * 使用绝对索引读取字节，不改变读位置。
     * @param index 索引
     * @return 字节值
     * @throws IndexOutOfBoundsException 索引不在已写入的范围内
     */
    public byte getByte(int index) {
        Preconditions.checkElementIndex(index, writerIndex);
        return buf[index];
    }

    /**
     * 使用绝对索引复制数据到dst，不改变读位置。
     */
    public ByteBuf getBytes(int index, byte[] dst) {
        Preconditions.checkPositionIndexes(index, index + dst.length, writerIndex);
        System.arraycopy(buf, index, dst, 0, dst.length);
        return this;
    }

    /**
     * 查找某字节值的索引
     * @param fromIndex 从该索引开始
     * @param toIndex 到该索引结束（不包含）
     * @param value 查找的字节值
     * @return 该值的第一个索引值，没有找到返回-1
     */
    public int indexOf(int fromIndex, int toIndex, byte value) {
        int end = Math.min(toIndex, writerIndex);
        for (int i = fromIndex; i < end; i++) {
            if (buf[i] == value) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 丢弃已读数据，把未读数据移到数组开头。
     * @return 本对象
     */
    public ByteBuf discardReadBytes() {
        if (readerIndex == 0) {
            return this;
        }
        int readable = readableBytes();
        System.arraycopy(buf, readerIndex, buf, 0, readable);
        readerIndex = 0;
        writerIndex = readable;
        return this;
    }

    private void ensureWritable(int remaining) {
        if (writableBytes() < remaining) {
            capacity(buf.length * 2 + remaining);
        }
    }

    private void capacity(int i) {
        Preconditions.checkState(i > buf.length);
        buf = Arrays.copyOf(buf, i);
    }
}
