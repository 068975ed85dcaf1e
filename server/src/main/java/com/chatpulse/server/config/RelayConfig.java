package com.chatpulse.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Flushes per-connection outbound queues to the sockets. */
    @Bean(name = "relayOutboundExecutor", destroyMethod = "shutdownNow")
    public ExecutorService relayOutboundExecutor(@Value("${relay.outbound.threads:8}") int threads) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "relay-outbound-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
