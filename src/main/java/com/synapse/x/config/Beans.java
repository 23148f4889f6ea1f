package com.synapse.x.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;


@Configuration
@Slf4j
public class Beans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "candidateLookupExecutor", destroyMethod = "shutdown")
    public ExecutorService candidateLookupExecutor(MeterRegistry meterRegistry,
                                                   @Value("${synapse.ranking.lookup-threads:16}") int threads) {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("candidate-lookup-%d")
                .setDaemon(true)
                .build();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                threadFactory,
                // rejected chunks are dropped by the fetcher instead of running on the request thread
                new ThreadPoolExecutor.AbortPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("candidate_lookup_executor_rejections").increment();
                        log.warn("Candidate lookup task rejected: queue size={}", e.getQueue().size());
                        super.rejectedExecution(r, e);
                    }
                }
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Bean(name = "batchRecommendExecutor", destroyMethod = "shutdown")
    public ExecutorService batchRecommendExecutor(@Value("${synapse.ranking.batch-concurrency:5}") int permits) {
        return new ThreadPoolExecutor(
                permits,
                permits,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("batch-recommend-%d").setDaemon(true).build()
        );
    }
}
