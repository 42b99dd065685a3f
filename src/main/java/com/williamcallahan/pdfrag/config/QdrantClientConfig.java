package com.williamcallahan.pdfrag.config;

import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Qdrant gRPC client with keepalive so idle connections survive load balancers.
 */
@Configuration
public class QdrantClientConfig {

    private static final Logger log = LoggerFactory.getLogger(QdrantClientConfig.class);

    private static final long KEEPALIVE_TIME_SECONDS = 30;
    private static final long KEEPALIVE_TIMEOUT_SECONDS = 10;
    private static final long IDLE_TIMEOUT_MINUTES = 5;

    /**
     * Creates the client; the channel is owned by the client and closed with it.
     *
     * @param appProperties connection settings under {@code app.qdrant}
     * @return configured Qdrant client
     */
    @Bean(destroyMethod = "close")
    public QdrantClient qdrantClient(AppProperties appProperties) {
        AppProperties.Qdrant qdrant = appProperties.getQdrant();
        log.info("[QDRANT] Connecting to {}:{} (tls={})", qdrant.getHost(), qdrant.getPort(), qdrant.isUseTls());

        ManagedChannelBuilder<?> channelBuilder = ManagedChannelBuilder.forAddress(qdrant.getHost(), qdrant.getPort());
        if (qdrant.isUseTls()) {
            channelBuilder.useTransportSecurity();
        } else {
            channelBuilder.usePlaintext();
        }
        channelBuilder
                .keepAliveTime(KEEPALIVE_TIME_SECONDS, TimeUnit.SECONDS)
                .keepAliveTimeout(KEEPALIVE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .keepAliveWithoutCalls(true)
                .idleTimeout(IDLE_TIMEOUT_MINUTES, TimeUnit.MINUTES);

        ManagedChannel channel = Objects.requireNonNull(channelBuilder.build(), "ManagedChannel");
        QdrantGrpcClient.Builder grpcClientBuilder = QdrantGrpcClient.newBuilder(channel, true);
        String apiKey = qdrant.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            grpcClientBuilder.withApiKey(apiKey);
        }
        return new QdrantClient(grpcClientBuilder.build());
    }
}
