package com.supersoft.photonest.media_import_processor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableScheduling
public class SchedulingConfig {

    @Value("${picker.import.lease.threads:4}")
    private int leaseThreads;

    /**
     * Shared ticker pool for heartbeat leases. Created once and shut down with the context.
     */
    @Bean(name = "leaseScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService leaseScheduler() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "lease-heartbeat-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newScheduledThreadPool(leaseThreads, threadFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
