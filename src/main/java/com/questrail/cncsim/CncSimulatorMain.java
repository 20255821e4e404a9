package com.questrail.cncsim;

import com.questrail.cncsim.config.EnvironmentConfigLoader;
import com.questrail.cncsim.config.SimulationConfig;
import com.questrail.cncsim.observability.Slf4jSimulationObservabilitySink;
import com.questrail.cncsim.runtime.SimulationRuntime;
import com.questrail.cncsim.transport.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point. Reads configuration from the environment, runs
 * the simulation until the JVM is asked to shut down, then stops it cleanly.
 */
public final class CncSimulatorMain
{
    private static final Logger log = LoggerFactory.getLogger(CncSimulatorMain.class);

    private CncSimulatorMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        SimulationConfig config;
        try {
            config = EnvironmentConfigLoader.fromSystemEnvironment();
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            System.exit(2);
            return;
        }

        log.info("Starting CNC telemetry simulator: sink={} format={} interval={}ms enterprise={} site={}",
                config.sinkType(), config.schemaSelection(), config.publishInterval().toMillis(),
                config.enterprise(), config.site());

        SimulationRuntime runtime = SimulationRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jSimulationObservabilitySink())
                .build();

        try {
            runtime.start();
        } catch (ConnectionException e) {
            log.error("Could not connect: {}", e.getMessage(), e);
            runtime.stop();
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            runtime.stop();
            stopped.countDown();
        }, "cncsim-shutdown"));

        stopped.await();
    }
}
