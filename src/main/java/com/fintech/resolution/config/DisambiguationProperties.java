package com.fintech.resolution.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Lifetime of a pending clarification.
 */
@ConfigurationProperties(prefix = "resolution.disambiguation")
@NoArgsConstructor
@Getter
@Setter
public class DisambiguationProperties {

    /** Turns a clarification may stay unanswered before it expires. Default 1. */
    private int maxTurns = 1;

    /** Wall-clock lifetime of a clarification. Default 10 minutes. */
    private Duration ttl = Duration.ofMinutes(10);
}
