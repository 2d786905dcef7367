package io.dealmotion.autopilot.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the detection, sweep and watchdog schedules. The test profile sets {@code
 * autopilot.scheduling.enabled=false} so jobs only run when a test invokes them.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(
    name = "autopilot.scheduling.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SchedulingConfig {}
