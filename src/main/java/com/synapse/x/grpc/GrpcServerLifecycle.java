package com.synapse.x.grpc;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.grpc.Server;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the Netty gRPC server alongside the Spring context. Disabled with
 * {@code synapse.grpc.enabled=false}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "synapse.grpc", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GrpcServerLifecycle implements SmartLifecycle {

    private final FeatureStoreGrpcService featureStoreService;
    private final int port;
    private final int threads;
    private final long shutdownGraceSeconds;

    private ExecutorService executor;
    private volatile Server server;

    public GrpcServerLifecycle(FeatureStoreGrpcService featureStoreService,
                               @Value("${synapse.grpc.port:50051}") int port,
                               @Value("${synapse.grpc.threads:16}") int threads,
                               @Value("${synapse.grpc.shutdown-grace-seconds:10}") long shutdownGraceSeconds) {
        this.featureStoreService = featureStoreService;
        this.port = port;
        this.threads = threads;
        this.shutdownGraceSeconds = shutdownGraceSeconds;
    }

    @Override
    public void start() {
        executor = Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("grpc-feature-store-%d").setDaemon(true).build());
        try {
            server = NettyServerBuilder.forPort(port)
                    .executor(executor)
                    .addService(featureStoreService)
                    .build()
                    .start();
        } catch (IOException e) {
            executor.shutdownNow();
            throw new UncheckedIOException("Failed to start gRPC server on port " + port, e);
        }
        log.info("gRPC server started on port {}", server.getPort());
    }

    @Override
    public void stop() {
        Server current = server;
        if (current == null) return;
        log.info("Stopping gRPC server...");
        current.shutdown();
        try {
            if (!current.awaitTermination(shutdownGraceSeconds, TimeUnit.SECONDS)) {
                log.warn("gRPC server did not drain within {}s, forcing shutdown", shutdownGraceSeconds);
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.shutdownNow();
        } finally {
            executor.shutdownNow();
            server = null;
        }
    }

    @Override
    public boolean isRunning() {
        return server != null && !server.isShutdown();
    }
}
