package com.deeplog.deeplog.recent;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of recent-timers configuration properties.
 */
@Configuration
@EnableConfigurationProperties(RecentTimerProperties.class)
public class RecentTimerConfig {
}
