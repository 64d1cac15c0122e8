package com.trade.orchestra.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "orchestra.portfolio")
public class PortfolioProperties {

    @NotBlank
    private String id = "main";

    @NotBlank
    private String name = "Main portfolio";

    @PositiveOrZero
    private double startingEquity = 0;

    @Positive
    private long syncIntervalMs = 15_000;

    private boolean syncEnabled = false;
}
