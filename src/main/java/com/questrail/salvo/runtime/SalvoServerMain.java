package com.questrail.salvo.runtime;

import com.questrail.salvo.config.ServerConfig;
import com.questrail.salvo.config.ServerConfigLoader;
import com.questrail.salvo.observability.Slf4jSalvoObservabilitySink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Runs until the JVM receives a termination signal.
 */
public final class SalvoServerMain
{
    private static final Logger log = LoggerFactory.getLogger(SalvoServerMain.class);

    private SalvoServerMain() {
    }

    public static void main(String[] args) throws InterruptedException
    {
        ServerConfig config;
        try {
            config = ServerConfigLoader.load();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        SalvoServerRuntime runtime = SalvoServerRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jSalvoObservabilitySink())
                .build();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            runtime.stop();
            stopped.countDown();
        }, "salvo-shutdown"));

        runtime.start();
        stopped.await();
    }
}
