package io.github.dredis.kv;

import java.io.IOException;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 接受新连接，为每个连接创建{@link ClientHandler}开始读请求。
 * 无论本次accept成功还是失败，只要监听的channel还开着就继续accept下一个连接。
 */
class AcceptHandler implements CompletionHandler<AsynchronousSocketChannel, KeyValueEngine> {
    private static final Logger logger = LoggerFactory.getLogger(AcceptHandler.class);

    private final AsynchronousServerSocketChannel serverSocketChannel;
    private final int                             readBufferSize;

    AcceptHandler(AsynchronousServerSocketChannel serverSocketChannel, int readBufferSize) {
        this.serverSocketChannel = serverSocketChannel;
        this.readBufferSize = readBufferSize;
    }

    void accept(KeyValueEngine engine) {
        if (serverSocketChannel.isOpen()) {
            serverSocketChannel.accept(engine, this);
        }
    }

    @Override
    public void completed(AsynchronousSocketChannel channel, KeyValueEngine engine) {
        accept(engine);
        try {
            ClientHandler handler = new ClientHandler(channel, readBufferSize);
            logger.info("accepted connection from {}.", handler.getRemote());
            handler.read(engine);
        } catch (IOException e) {
            logger.error("accept connection failed.", e);
            try {
                channel.close();
            } catch (IOException ce) {
                logger.warn("close channel failed.", ce);
            }
        }
    }

    @Override
    public void failed(Throwable exc, KeyValueEngine engine) {
        if (serverSocketChannel.isOpen()) {
            logger.error("kv server accept error.", exc);
            accept(engine);
        }
    }
}
