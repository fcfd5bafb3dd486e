package org.example.helpdesk.config;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;

/**
 * Checks that the HTTP port can be bound before the application context starts.
 */
public final class PortAvailabilityChecker {

    private PortAvailabilityChecker() {
    }

    /**
     * @return true if {@code 0.0.0.0:port} could be bound and released again
     */
    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress("0.0.0.0", port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
