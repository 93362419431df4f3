package server;

import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.util.concurrent.ExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import server.rpc.ClientApi;
import server.rpc.ClientGateway;
import server.rpc.JsonRpcService;

@Slf4j
@SpringBootApplication(scanBasePackages = {"server"}, proxyBeanMethods = false)
public class NoiceApplication {

    public static void main(String[] args) throws Exception {
        var ctx = SpringApplication.run(NoiceApplication.class, args);

        var socketHandler = ctx.getBean(UnixSocketHandler.class);
        socketHandler.createUnixSocket();
        Runtime.getRuntime().addShutdownHook(new Thread(socketHandler::cleanup));

        var rpc = ctx.getBean(JsonRpcService.class);
        var gateway = ctx.getBean(ClientGateway.class);
        while (true) {
            log.info("Waiting for connection on {}", socketHandler.getSocketPath());
            SocketChannel channel = socketHandler.acceptClient();

            Launcher<ClientApi> launcher =
                    new Launcher.Builder<ClientApi>()
                            .setLocalService(rpc)
                            .setRemoteInterface(ClientApi.class)
                            .setInput(Channels.newInputStream(channel))
                            .setOutput(Channels.newOutputStream(channel))
                            .create();
            gateway.setClient(launcher.getRemoteProxy());
            log.info("JSON-RPC client connected");
            try {
                launcher.startListening().get();
            } catch (ExecutionException e) {
                log.warn("JSON-RPC connection ended with error", e.getCause());
            } finally {
                gateway.setClient(null);
                socketHandler.closeClient();
                log.info("JSON-RPC client disconnected");
            }
        }
    }
}
