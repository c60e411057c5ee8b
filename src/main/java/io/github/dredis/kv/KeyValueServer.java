package io.github.dredis.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.AsynchronousChannelGroup;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 使用java nio监听指定端口，由{@link AcceptHandler}接受连接，每个连接由一个{@link ClientHandler}完成redis resp协议解析，
 * 使用{@link KeyValueEngine}处理，再由{@link WriteHandler}返回响应。
 * <p>
 * 所有连接的读写回调都在同一个固定大小的线程池中执行，连接之间互不阻塞。
 * </p>
 */
public class KeyValueServer {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueServer.class);
    // 服务地址，端口为0时启动后更新为实际端口
    @Getter
    private volatile InetSocketAddress               socketAddress;
    private final    KeyValueEngine                  engine;
    private final    int                             threads;
    private final    int                             readBufferSize;
    private volatile boolean                         started = false;
    private          AsynchronousServerSocketChannel serverSocketChannel;
    private          AsynchronousChannelGroup        channelGroup;

    @Builder
    public KeyValueServer(@NonNull InetSocketAddress socketAddress,
                          @NonNull KeyValueEngine keyValueEngine,
                          Integer threads,
                          Integer readBufferSize) {
        this.socketAddress = socketAddress;
        this.engine = keyValueEngine;
        this.threads = threads == null ? 20 : threads;
        this.readBufferSize = readBufferSize == null ? 2048 : readBufferSize;
        Preconditions.checkArgument(this.threads > 0, "threads must be positive");
        Preconditions.checkArgument(this.readBufferSize > 0, "readBufferSize must be positive");
    }

    /**
     * 启动服务
     *
     * @throws IOException 监听端口失败
     */
    public synchronized void start() throws IOException {
        Preconditions.checkState(!started, "already started");
        channelGroup = AsynchronousChannelGroup.withFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("dredis-io-%d").setDaemon(true).build());
        serverSocketChannel = AsynchronousServerSocketChannel.open(channelGroup);
        serverSocketChannel.bind(socketAddress);
        socketAddress = (InetSocketAddress) serverSocketChannel.getLocalAddress();
        new AcceptHandler(serverSocketChannel, readBufferSize).accept(engine);
        started = true;
        logger.info("kv server listening on {}.", socketAddress);
    }

    /**
     * 关闭服务，同时关闭所有客户连接。
     *
     * @throws IOException 关闭异常
     */
    public synchronized void shutdown() throws IOException {
        if (!started) {
            return;
        }
        started = false;
        serverSocketChannel.close();
        channelGroup.shutdownNow();
        try {
            if (!channelGroup.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("kv server io threads did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("kv server on {} shutdown.", socketAddress);
    }

    public boolean isStarted() {
        return started;
    }
}
