package org.example.helpdesk.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.config.HelpdeskProperties;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs the retention sweep on a fixed delay taken from {@code helpdesk.retention}.
 * The first sweep runs one interval after startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketRetentionWorker implements SchedulingConfigurer {

    private final TicketRetentionService retentionService;
    private final HelpdeskProperties properties;

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        HelpdeskProperties.Retention retention = properties.retention();
        if (!retention.enabled()) {
            log.info("Ticket retention sweep is disabled");
            return;
        }

        Duration interval = retention.cleanupInterval();
        taskRegistrar.addFixedDelayTask(new FixedDelayTask(this::run, interval, interval));
        log.info("Ticket retention sweep scheduled every {} (retention: {} days)",
                interval, retention.retentionDays());
    }

    public void run() {
        retentionService.purgeExpired();
    }
}
