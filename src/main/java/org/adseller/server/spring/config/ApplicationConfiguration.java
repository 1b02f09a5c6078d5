package org.adseller.server.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.http.HttpClientOptions;
import org.adseller.server.execution.TimeoutExecutor;
import org.adseller.server.execution.TimeoutFactory;
import org.adseller.server.identity.IdGenerator;
import org.adseller.server.identity.UUIDIdGenerator;
import org.adseller.server.json.JacksonMapper;
import org.adseller.server.json.ObjectMapperProvider;
import org.adseller.server.metric.Metrics;
import org.adseller.server.vertx.httpclient.BasicHttpClient;
import org.adseller.server.vertx.httpclient.HttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ApplicationConfiguration {

    @Bean
    Vertx vertx(@Value("${vertx.worker-pool-size}") int workerPoolSize) {
        return Vertx.vertx(new VertxOptions().setWorkerPoolSize(workerPoolSize));
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    JacksonMapper jacksonMapper() {
        return new JacksonMapper(ObjectMapperProvider.mapper());
    }

    @Bean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    Metrics metrics(MeterRegistry meterRegistry) {
        return new Metrics(meterRegistry);
    }

    @Bean
    TimeoutFactory timeoutFactory(Clock clock) {
        return new TimeoutFactory(clock);
    }

    @Bean
    TimeoutExecutor timeoutExecutor(Vertx vertx) {
        return new TimeoutExecutor(vertx);
    }

    @Bean
    IdGenerator idGenerator() {
        return new UUIDIdGenerator();
    }

    @Bean
    HttpClient httpClient(Vertx vertx,
                          @Value("${http-client.max-pool-size}") int maxPoolSize,
                          @Value("${http-client.connect-timeout-ms}") int connectTimeoutMs) {

        final HttpClientOptions options = new HttpClientOptions()
                .setMaxPoolSize(maxPoolSize)
                .setConnectTimeout(connectTimeoutMs)
                .setTryUseCompression(true);

        return new BasicHttpClient(vertx.createHttpClient(options));
    }
}
