package server.rpc;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Single thread on which all client requests touch the sound player manager. */
@Slf4j
@Configuration
public class EventDispatchThreadConfig {

    @Bean(name = "edt", destroyMethod = "shutdown")
    public ExecutorService edt() {
        return Executors.newSingleThreadExecutor(
                r -> {
                    Thread t = new Thread(r, "RpcDispatchThread");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler(
                            (thread, e) -> log.error("Uncaught exception on {}", thread, e));
                    return t;
                });
    }
}
