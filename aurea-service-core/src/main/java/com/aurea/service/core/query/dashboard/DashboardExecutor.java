package com.aurea.service.core.query.dashboard;

import com.aurea.service.core.config.AnalyticsProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Bounded worker pool running the independent analyses of a dashboard request. */
@Component
@Slf4j
@RequiredArgsConstructor
public class DashboardExecutor {

    private final AnalyticsProperties analyticsProperties;

    private ExecutorService executor;
    private final AtomicInteger threadIds = new AtomicInteger();

    @PostConstruct
    void start() {
        init(analyticsProperties.getDashboard().getWorkers());
    }

    void init(int workers) {
        int size = Math.max(1, workers);
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "dashboard-worker-" + threadIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        executor = Executors.newFixedThreadPool(size, threads);
        log.info("Dashboard executor started workers={}", size);
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public <T> CompletableFuture<T> submit(Supplier<T> analysis) {
        return CompletableFuture.supplyAsync(analysis, executor);
    }
}
