package org.retrier.spring.config;

import io.vertx.core.Future;
import org.junit.jupiter.api.Test;
import org.retrier.backoff.ExponentialBackoffPolicy;
import org.retrier.backoff.FixedBackoffPolicy;
import org.retrier.execution.CancellationTokenFactory;
import org.retrier.execution.Retrier;
import org.retrier.execution.RetryFailureHandler;
import org.retrier.spring.config.model.BackoffType;
import org.retrier.spring.config.model.RetryProperties;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class RetrierConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    ConfigurationPropertiesAutoConfiguration.class,
                    ValidationAutoConfiguration.class))
            .withUserConfiguration(RetrierConfiguration.class);

    @Test
    public void retrierShouldUseFixedBackoffByDefault() {
        contextRunner
                .withPropertyValues("retry.retries=3")
                .run(context -> {
                    assertThat(context).hasSingleBean(Retrier.class);
                    assertThat(context).hasSingleBean(CancellationTokenFactory.class);

                    final Retrier retrier = context.getBean(Retrier.class);
                    assertThat(retrier.retries()).isEqualTo(3);
                    assertThat(retrier.isUnlimited()).isFalse();
                    assertThat(retrier.backoffPolicy()).isEqualTo(FixedBackoffPolicy.of(1000L));
                });
    }

    @Test
    public void retrierShouldBeConfiguredWithFixedBackoff() {
        contextRunner
                .withPropertyValues(
                        "retry.retries=-1",
                        "retry.backoff=fixed",
                        "retry.fixed.period-ms=250")
                .run(context -> {
                    final Retrier retrier = context.getBean(Retrier.class);
                    assertThat(retrier.isUnlimited()).isTrue();
                    assertThat(retrier.backoffPolicy()).isEqualTo(FixedBackoffPolicy.of(250L));
                });
    }

    @Test
    public void retrierShouldBeConfiguredWithExponentialBackoff() {
        contextRunner
                .withPropertyValues(
                        "retry.retries=5",
                        "retry.backoff=exponential",
                        "retry.exponential.delay-millis=500",
                        "retry.exponential.max-delay-millis=5000",
                        "retry.exponential.factor=2")
                .run(context -> {
                    final Retrier retrier = context.getBean(Retrier.class);
                    assertThat(retrier.retries()).isEqualTo(5);
                    assertThat(retrier.backoffPolicy()).isEqualTo(ExponentialBackoffPolicy.of(500L, 5000L, 2));
                });
    }

    @Test
    public void retrierShouldNotifyFailureHandlerBeanIfPresent() {
        final List<Integer> failedAttempts = new ArrayList<>();
        final RetryFailureHandler failureHandler = (error, attempt, willRetry, nextDelay) ->
                failedAttempts.add(attempt);

        contextRunner
                .withPropertyValues("retry.retries=0")
                .withBean(RetryFailureHandler.class, () -> failureHandler)
                .run(context -> {
                    final Future<Void> future = context.getBean(Retrier.class)
                            .execute(attempt -> Future.failedFuture("failure"));

                    assertThat(future.failed()).isTrue();
                    assertThat(failedAttempts).containsExactly(1);
                });
    }

    @Test
    public void contextShouldFailIfRetriesAreNotConfigured() {
        contextRunner.run(context -> assertThat(context).hasFailed());
    }

    @Test
    public void contextShouldFailOnInvalidExponentialBackoff() {
        contextRunner
                .withPropertyValues(
                        "retry.retries=1",
                        "retry.backoff=exponential",
                        "retry.exponential.delay-millis=500",
                        "retry.exponential.max-delay-millis=5000",
                        "retry.exponential.factor=0.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    public void toBackoffPolicyShouldFailIfExponentialBackoffIsNotConfigured() {
        // given
        final RetryProperties properties = new RetryProperties();
        properties.setRetries(1);
        properties.setBackoff(BackoffType.EXPONENTIAL);

        // when and then
        assertThatIllegalArgumentException().isThrownBy(properties::toBackoffPolicy);
    }
}
