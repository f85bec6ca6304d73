package org.retrier.spring.config.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.validation.annotation.Validated;

@Validated
@Data
@NoArgsConstructor
public class ExponentialBackoffProperties {

    @NotNull
    @Min(0)
    private Long delayMillis;

    @NotNull
    @Min(0)
    private Long maxDelayMillis;

    @NotNull
    @DecimalMin("1.0")
    private Double factor;
}
