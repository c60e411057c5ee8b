package io.github.dredis.kv;

import java.io.IOException;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.nio.channels.AsynchronousSocketChannel;

import io.github.dredis.store.MemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AcceptHandlerTest {
    private AsynchronousServerSocketChannel serverSocketChannel;
    private AcceptHandler                   handler;
    private KeyValueEngine                  engine;

    @BeforeEach
    void beforeEach() {
        serverSocketChannel = mock(AsynchronousServerSocketChannel.class);
        handler = new AcceptHandler(serverSocketChannel, 64);
        engine = KeyValueEngine.builder().store(new MemoryStore()).build();
    }

    @Test
    void keepAcceptingAfterFailure() {
        when(serverSocketChannel.isOpen()).thenReturn(true);

        handler.failed(new IOException("Too many open files"), engine);

        verify(serverSocketChannel).accept(same(engine), same(handler));
    }

    @Test
    void stopAcceptingWhenClosed() {
        when(serverSocketChannel.isOpen()).thenReturn(false);

        handler.failed(new IOException("closed"), engine);

        verify(serverSocketChannel, never()).accept(any(), any());
    }

    @Test
    void keepAcceptingWhenNewConnectionIsBroken() throws IOException {
        when(serverSocketChannel.isOpen()).thenReturn(true);
        AsynchronousSocketChannel channel = mock(AsynchronousSocketChannel.class);
        when(channel.getRemoteAddress()).thenThrow(new IOException("reset"));

        handler.completed(channel, engine);

        verify(serverSocketChannel, times(1)).accept(same(engine), same(handler));
        verify(channel).close();
    }
}
