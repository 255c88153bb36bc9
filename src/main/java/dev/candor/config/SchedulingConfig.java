package dev.candor.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Enables the background cache sweep. */
@Configuration
@EnableScheduling
public class SchedulingConfig {}
