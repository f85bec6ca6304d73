package org.retrier.spring.config;

import io.vertx.core.Vertx;
import org.retrier.execution.CancellationTokenFactory;
import org.retrier.execution.Retrier;
import org.retrier.execution.RetryFailureHandler;
import org.retrier.spring.config.model.RetryProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RetrierConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "retry")
    RetryProperties retryProperties() {
        return new RetryProperties();
    }

    @Bean
    Retrier retrier(Vertx vertx,
                    RetryProperties retryProperties,
                    @Autowired(required = false) RetryFailureHandler retryFailureHandler) {

        final Retrier retrier = new Retrier(vertx, retryProperties.getRetries(), retryFailureHandler);
        retrier.setBackoffPolicy(retryProperties.toBackoffPolicy());
        return retrier;
    }

    @Bean
    CancellationTokenFactory cancellationTokenFactory(Vertx vertx, Clock clock) {
        return new CancellationTokenFactory(vertx, clock);
    }

    @Configuration
    public static class VertxConfiguration {

        @Bean(destroyMethod = "close")
        Vertx vertx() {
            return Vertx.vertx();
        }

        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }
}
