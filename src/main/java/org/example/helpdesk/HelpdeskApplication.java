package org.example.helpdesk;

import org.example.helpdesk.config.FatalErrorHandler;
import org.example.helpdesk.config.StartupPortCheckListener;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Helpdesk Ticket Service.
 *
 * <p>This application provides:
 * <ul>
 *     <li>RESTful API for ticket create, list, update, resolve, decline and delete</li>
 *     <li>In-memory ticket store, cleared on restart</li>
 *     <li>Dashboard statistics</li>
 *     <li>Scheduled retention sweep of old tickets</li>
 * </ul>
 *
 * <p>Shutdown is graceful: in-flight requests get up to five seconds to finish.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class HelpdeskApplication {

    public static void main(String[] args) {
        FatalErrorHandler.install();

        SpringApplication application = new SpringApplication(HelpdeskApplication.class);
        application.addListeners(new StartupPortCheckListener());
        application.run(args);
    }

}
