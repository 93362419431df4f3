package server;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Owns the Unix domain socket clients connect to. One client is served at a time. */
@Slf4j
@Component
public class UnixSocketHandler {
    private final Path socketPath;
    private ServerSocketChannel serverChannel;
    private volatile SocketChannel clientChannel;

    public UnixSocketHandler(@Value("${noice.socket-path:/tmp/noice}") String socketPath) {
        this.socketPath = Path.of(socketPath);
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public void createUnixSocket() throws IOException {
        if (Files.deleteIfExists(socketPath)) {
            log.info("Removed existing socket at {}", socketPath);
        }

        serverChannel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        serverChannel.bind(UnixDomainSocketAddress.of(socketPath));
        log.info("Created Unix domain socket at {}", socketPath);
    }

    /** Blocks until the next client connects, closing the previous one. */
    public SocketChannel acceptClient() throws IOException {
        if (serverChannel == null) {
            throw new IOException("Unix socket not created");
        }
        closeClient();
        SocketChannel channel = serverChannel.accept();
        clientChannel = channel;
        log.info("Client connected to {}", socketPath);
        return channel;
    }

    public boolean isClientConnected() {
        SocketChannel channel = clientChannel;
        return channel != null && channel.isOpen();
    }

    public void closeClient() {
        SocketChannel channel = clientChannel;
        clientChannel = null;
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Error closing client connection", e);
        }
    }

    public void cleanup() {
        closeClient();
        try {
            if (serverChannel != null) {
                serverChannel.close();
            }
            Files.deleteIfExists(socketPath);
            log.info("Cleaned up Unix socket at {}", socketPath);
        } catch (IOException e) {
            log.error("Error cleaning up Unix socket", e);
        }
    }
}
