package io.github.dredis;

import java.io.IOException;

import io.github.dredis.kv.KeyValueEngine;
import io.github.dredis.kv.KeyValueServer;
import io.github.dredis.store.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws Exception {
        ServerConf conf = ServerConf.fromSystemProperties();
        logger.info("starting with {}", conf);

        KeyValueEngine engine = KeyValueEngine.builder()
                .store(new MemoryStore())
                .build();

        KeyValueServer server = KeyValueServer.builder()
                .socketAddress(conf.getSocketAddress())
                .keyValueEngine(engine)
                .threads(conf.getThreads())
                .readBufferSize(conf.getReadBufferSize())
                .build();
        server.start();
        logger.info("dredis is running on {}", server.getSocketAddress());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("服务进程退出.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.error("shutdown kv server failed.", e);
            }
        }, "dredis-shutdown"));

        Thread.currentThread().join();
    }
}
