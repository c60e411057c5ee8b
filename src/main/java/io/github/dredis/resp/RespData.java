package io.github.dredis.resp;

import java.nio.ByteBuffer;

/**
 * resp协议的数据单元，请求和响应都由它组成。
 */
public interface RespData {

    byte[] toBytes();

    default ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toBytes());
    }
}
