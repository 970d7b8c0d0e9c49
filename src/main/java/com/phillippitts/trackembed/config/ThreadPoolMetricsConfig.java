package com.phillippitts.trackembed.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the pipeline and download executors via Micrometer.
 *
 * <p>For each pool ({@code pipeline}, {@code download}):
 * <ul>
 *   <li>trackembed.pool.size - Current number of threads in the pool</li>
 *   <li>trackembed.pool.active - Number of actively executing tasks</li>
 *   <li>trackembed.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>trackembed.pool.completed - Cumulative count of completed tasks</li>
 * </ul>
 * tagged with {@code pool}. Available via {@code GET /actuator/metrics/trackembed.pool.active}.
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> downloadExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider,
            @Qualifier("downloadExecutor") ObjectProvider<ThreadPoolTaskExecutor> downloadExecutorProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
        this.downloadExecutorProvider = downloadExecutorProvider;
    }

    /**
     * Binds both executors to the meter registry.
     *
     * @return MeterBinder that registers the pool gauges
     */
    @Bean
    public MeterBinder pipelineExecutorMetrics() {
        return registry -> {
            bind(registry, "pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "download", downloadExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: trackembed.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("trackembed.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("trackembed.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("trackembed.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("trackembed.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs pool health every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor jobs = pipelineExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor downloads = downloadExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Pipeline pool: size={}/{}, active={}, queued={}; download pool: size={}/{}, active={}, queued={}",
                jobs.getPoolSize(), jobs.getMaximumPoolSize(), jobs.getActiveCount(), jobs.getQueue().size(),
                downloads.getPoolSize(), downloads.getMaximumPoolSize(), downloads.getActiveCount(),
                downloads.getQueue().size());
    }
}
