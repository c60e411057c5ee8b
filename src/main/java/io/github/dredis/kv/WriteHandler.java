package io.github.dredis.kv;

import java.nio.ByteBuffer;
import java.nio.channels.CompletionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 将响应中的buffer数据全部返回给客户端，然后继续读下一批请求，或者关闭连接。
 */
class WriteHandler implements CompletionHandler<Integer, KeyValueEngine> {
    private static final Logger logger = LoggerFactory.getLogger(WriteHandler.class);

    private final ClientHandler clientHandler;
    private final ByteBuffer    response;
    private final boolean       closeAfterWrite;

    WriteHandler(ClientHandler clientHandler, ByteBuffer response, boolean closeAfterWrite) {
        this.clientHandler = clientHandler;
        this.response = response;
        this.closeAfterWrite = closeAfterWrite;
    }

    @Override
    public void completed(Integer result, KeyValueEngine engine) {
        if (response.hasRemaining()) {
            clientHandler.getChannel().write(response, engine, this);
        } else if (closeAfterWrite) {
            clientHandler.close();
        } else {
            clientHandler.read(engine);
        }
    }

    @Override
    public void failed(Throwable exc, KeyValueEngine engine) {
        logger.error("kv server write failed.", exc);
        clientHandler.close();
    }
}
