package org.example.helpdesk.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.ConfigurableEnvironment;

/**
 * Refuses to start the application when {@code server.port} is already taken.
 * Runs as soon as the environment is known, before any bean is created.
 */
@Slf4j
public class StartupPortCheckListener implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        ConfigurableEnvironment environment = event.getEnvironment();
        if (!environment.getProperty("helpdesk.startup.check-port", Boolean.class, true)) {
            return;
        }

        int port = environment.getProperty("server.port", Integer.class, 8080);
        if (port <= 0) {
            return;
        }
        if (!PortAvailabilityChecker.isPortAvailable(port)) {
            log.error("Port {} is already in use", port);
            throw new IllegalStateException("Port " + port + " is already in use");
        }
        log.debug("Port {} is available", port);
    }
}
