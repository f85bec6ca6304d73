package org.retrier.spring.config.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.validation.annotation.Validated;

@Validated
@Data
@NoArgsConstructor
public class FixedBackoffProperties {

    @NotNull
    @Min(0)
    private Long periodMs = 1000L;
}
