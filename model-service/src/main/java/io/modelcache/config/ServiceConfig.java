package io.modelcache.config;

import java.nio.file.Path;

/**
 * Process settings from system properties, falling back to environment variables.
 *
 * @param modelsConfig      path to {@code models.yaml}; null means the copy bundled on the classpath
 * @param httpPort          HTTP admin port; gRPC listens on the next port up
 * @param deviceBytes       device memory capacity in bytes
 * @param loaderDelayMillis simulated load latency
 */
public record ServiceConfig(
        Path modelsConfig,
        int httpPort,
        long deviceBytes,
        long loaderDelayMillis
) {
    public static final long DEFAULT_DEVICE_BYTES = 24L * 1024 * 1024 * 1024;

    public int grpcPort() { return httpPort + 1; }

    public static ServiceConfig fromEnv() {
        String cfg = System.getProperty("modelcache.config", System.getenv().getOrDefault("MODELCACHE_CONFIG", ""));
        int port = Integer.parseInt(System.getProperty("modelcache.port", System.getenv().getOrDefault("MODELCACHE_PORT", "8080")));
        long device = Long.parseLong(System.getProperty("modelcache.device.bytes",
                System.getenv().getOrDefault("MODELCACHE_DEVICE_BYTES", Long.toString(DEFAULT_DEVICE_BYTES))));
        long delay = Long.parseLong(System.getProperty("modelcache.loader.delay.ms",
                System.getenv().getOrDefault("MODELCACHE_LOADER_DELAY_MS", "0")));
        return new ServiceConfig(cfg.isBlank() ? null : Path.of(cfg), port, device, delay);
    }
}
