package io.github.dredis.kv;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;

import io.github.dredis.resp.RespData;
import io.github.dredis.resp.RespDecoder;
import io.github.dredis.resp.RespProtocolException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 一个客户连接的读处理。
 * <p>
 * 读到数据后解码出所有完整的请求，依次执行，把响应按顺序合并后交给{@link WriteHandler}写回；
 * 响应全部写完才发起下一次读，所以同一个连接上的请求是串行处理的，响应顺序与请求顺序一致。
 * 解码失败说明字节流已经无法同步，写完之前请求的响应后关闭连接。
 * </p>
 */
class ClientHandler implements CompletionHandler<Integer, KeyValueEngine> {
    private static final Logger                    logger      = LoggerFactory.getLogger(ClientHandler.class);
    @Getter(AccessLevel.PACKAGE)
    private final        AsynchronousSocketChannel channel;
    private final        ByteBuffer                byteBuffer;
    private final        RespDecoder               respDecoder = RespDecoder.create();
    @Getter(AccessLevel.PACKAGE)
    private final        SocketAddress             remote;

    ClientHandler(@NonNull AsynchronousSocketChannel channel, int readBufferSize) throws IOException {
        this.channel = channel;
        this.byteBuffer = ByteBuffer.allocate(readBufferSize);
        this.remote = channel.getRemoteAddress();
    }

    void read(KeyValueEngine engine) {
        byteBuffer.clear();
        channel.read(byteBuffer, engine, this);
    }

    @Override
    public void completed(Integer result, KeyValueEngine engine) {
        if (result == -1) {
            logger.info("connection from {} closed by peer.", remote);
            close();
            return;
        }

        byteBuffer.flip();
        respDecoder.decode(byteBuffer);

        ByteArrayOutputStream responses = new ByteArrayOutputStream();
        boolean corrupted = false;
        try {
            RespData request;
            while ((request = respDecoder.get()) != null) {
                responses.writeBytes(engine.execute(request).toBytes());
            }
        } catch (RespProtocolException e) {
            logger.warn("protocol error from {}, close connection: {}", remote, e.getMessage());
            corrupted = true;
        } catch (RuntimeException e) {
            logger.error("handle requests from {} failed, close connection.", remote, e);
            corrupted = true;
        }

        if (responses.size() > 0) {
            ByteBuffer bb = ByteBuffer.wrap(responses.toByteArray());
            channel.write(bb, engine, new WriteHandler(this, bb, corrupted));
        } else if (corrupted) {
            close();
        } else {
            read(engine);
        }
    }

    @Override
    public void failed(Throwable exc, KeyValueEngine engine) {
        if (channel.isOpen()) {
            logger.error("read from {} failed.", remote, exc);
        }
        close();
    }

    void close() {
        try {
            channel.close();
        } catch (IOException e) {
            logger.warn("close connection from {} failed.", remote, e);
        }
    }
}
