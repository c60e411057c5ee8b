package io.github.dredis;

import java.net.InetSocketAddress;
import java.util.Properties;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 服务启动参数。可以用builder构造，也可以从系统属性读取：
 * <ul>
 * <li>dredis.address：host:port形式，优先于dredis.host和dredis.port</li>
 * <li>dredis.host：监听地址，默认0.0.0.0</li>
 * <li>dredis.port：监听端口，默认6379</li>
 * <li>dredis.threads：io线程数，默认20</li>
 * <li>dredis.readBufferSize：每个连接的读缓冲区大小，默认2048</li>
 * </ul>
 */
@Builder
@ToString
public class ServerConf {
    static final String ADDRESS          = "dredis.address";
    static final String HOST             = "dredis.host";
    static final String PORT             = "dredis.port";
    static final String THREADS          = "dredis.threads";
    static final String READ_BUFFER_SIZE = "dredis.readBufferSize";

    @Builder.Default
    @Getter
    private String host = "0.0.0.0";

    @Builder.Default
    @Getter
    private int port = 6379;

    @Builder.Default
    @Getter
    private int threads = 20;

    @Builder.Default
    @Getter
    private int readBufferSize = 2048;

    public InetSocketAddress getSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    public static ServerConf fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    static ServerConf fromProperties(Properties props) {
        ServerConfBuilder builder = ServerConf.builder();
        String prop = props.getProperty(HOST);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.host(prop);
        }
        prop = props.getProperty(PORT);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.port(parseInt(PORT, prop));
        }
        prop = props.getProperty(ADDRESS);
        if (!Strings.isNullOrEmpty(prop)) {
            InetSocketAddress address = getInetSocketAddress(prop);
            builder.host(address.getHostString()).port(address.getPort());
        }
        prop = props.getProperty(THREADS);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.threads(parseInt(THREADS, prop));
        }
        prop = props.getProperty(READ_BUFFER_SIZE);
        if (!Strings.isNullOrEmpty(prop)) {
            builder.readBufferSize(parseInt(READ_BUFFER_SIZE, prop));
        }
        return builder.build();
    }

    public static InetSocketAddress getInetSocketAddress(String prop) {
        int i = prop.lastIndexOf(':');
        Preconditions.checkArgument(i > 0 && i < prop.length() - 1, "address must be host:port, but was %s", prop);
        return new InetSocketAddress(prop.substring(0, i), parseInt(ADDRESS, prop.substring(i + 1)));
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, but was " + value, e);
        }
    }
}
