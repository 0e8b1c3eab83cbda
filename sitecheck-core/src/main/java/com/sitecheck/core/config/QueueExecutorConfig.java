package com.sitecheck.core.config;

import com.sitecheck.core.queue.QueueProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableScheduling
@Slf4j
public class QueueExecutorConfig {

    /**
     * Runs audit work off the request thread so a tick can stop waiting for it. Threads are
     * non-daemon: work that outlives its tick keeps running until it finishes.
     */
    @Bean(name = "auditExecutor", destroyMethod = "shutdown")
    public ExecutorService auditExecutor(QueueProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "audit-worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        log.info("Audit executor initialized with {} threads", properties.getWorkerThreads());
        return Executors.newFixedThreadPool(properties.getWorkerThreads(), threadFactory);
    }
}
