package io.github.dredis;

import java.net.InetSocketAddress;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfTest {

    @Test
    void defaults() {
        ServerConf conf = ServerConf.fromProperties(new Properties());

        assertEquals("0.0.0.0", conf.getHost());
        assertEquals(6379, conf.getPort());
        assertEquals(20, conf.getThreads());
        assertEquals(2048, conf.getReadBufferSize());
    }

    @Test
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty(ServerConf.HOST, "127.0.0.1");
        props.setProperty(ServerConf.PORT, "7000");
        props.setProperty(ServerConf.THREADS, "4");
        props.setProperty(ServerConf.READ_BUFFER_SIZE, "512");

        ServerConf conf = ServerConf.fromProperties(props);

        assertEquals(new InetSocketAddress("127.0.0.1", 7000), conf.getSocketAddress());
        assertEquals(4, conf.getThreads());
        assertEquals(512, conf.getReadBufferSize());
    }

    @Test
    void addressOverridesHostAndPort() {
        Properties props = new Properties();
        props.setProperty(ServerConf.HOST, "10.0.0.1");
        props.setProperty(ServerConf.PORT, "7000");
        props.setProperty(ServerConf.ADDRESS, "127.0.0.1:7001");

        ServerConf conf = ServerConf.fromProperties(props);

        assertEquals("127.0.0.1", conf.getHost());
        assertEquals(7001, conf.getPort());
    }

    @Test
    void invalidValues() {
        Properties props = new Properties();
        props.setProperty(ServerConf.PORT, "abc");
        assertThrows(IllegalArgumentException.class, () -> ServerConf.fromProperties(props));

        assertThrows(IllegalArgumentException.class, () -> ServerConf.getInetSocketAddress("localhost"));
        assertThrows(IllegalArgumentException.class, () -> ServerConf.getInetSocketAddress(":6379"));
        assertThrows(IllegalArgumentException.class, () -> ServerConf.getInetSocketAddress("localhost:"));
    }

    @Test
    void getInetSocketAddress() {
        assertEquals(new InetSocketAddress("127.0.0.1", 6380), ServerConf.getInetSocketAddress("127.0.0.1:6380"));
    }
}
