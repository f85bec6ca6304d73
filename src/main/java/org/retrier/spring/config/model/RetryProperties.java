package org.retrier.spring.config.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.retrier.backoff.BackoffPolicy;
import org.retrier.backoff.ExponentialBackoffPolicy;
import org.retrier.backoff.FixedBackoffPolicy;
import org.springframework.validation.annotation.Validated;

@Validated
@Data
@NoArgsConstructor
public class RetryProperties {

    /**
     * Negative value means retrying forever.
     */
    @NotNull
    private Integer retries;

    @NotNull
    private BackoffType backoff = BackoffType.FIXED;

    @Valid
    @NotNull
    private FixedBackoffProperties fixed = new FixedBackoffProperties();

    @Valid
    private ExponentialBackoffProperties exponential;

    public BackoffPolicy toBackoffPolicy() {
        return switch (backoff) {
            case FIXED -> FixedBackoffPolicy.of(fixed.getPeriodMs());
            case EXPONENTIAL -> exponentialBackoffPolicy();
        };
    }

    private BackoffPolicy exponentialBackoffPolicy() {
        if (exponential == null) {
            throw new IllegalArgumentException("exponential backoff is selected, but not configured");
        }

        return ExponentialBackoffPolicy.of(
                exponential.getDelayMillis(),
                exponential.getMaxDelayMillis(),
                exponential.getFactor());
    }
}
