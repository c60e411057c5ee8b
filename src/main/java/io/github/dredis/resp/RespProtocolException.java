package io.github.dredis.resp;

/**
 * 字节流不符合resp协议，无法继续解析。出现后连接上的数据无法再同步，只能关闭连接。
 */
public class RespProtocolException extends RuntimeException {
    private static final long serialVersionUID = -3920115375518764209L;

    public RespProtocolException(String message) {
        super(message);
    }

    public RespProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
