package org.example.helpdesk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Settings of the helpdesk service, bound from {@code helpdesk.*}.
 */
@ConfigurationProperties(prefix = "helpdesk")
public record HelpdeskProperties(
        @DefaultValue Upload upload,
        @DefaultValue Retention retention,
        @DefaultValue Errors errors,
        @DefaultValue Tickets tickets) {

    public record Upload(@DefaultValue("5MB") DataSize maxFileSize) {

        /**
         * @return the ceiling in the largest whole unit, e.g. {@code 5MB} or {@code 512KB}
         */
        public String maxFileSizeLabel() {
            long bytes = maxFileSize.toBytes();
            if (bytes > 0 && bytes % DataSize.ofMegabytes(1).toBytes() == 0) {
                return maxFileSize.toMegabytes() + "MB";
            }
            if (bytes > 0 && bytes % DataSize.ofKilobytes(1).toBytes() == 0) {
                return maxFileSize.toKilobytes() + "KB";
            }
            return bytes + "B";
        }
    }

    /**
     * @param enabled         schedule the retention sweep
     * @param retentionDays   age in days after which a ticket is removed
     * @param cleanupInterval delay between two sweeps, also the delay before the first one
     */
    public record Retention(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("30") int retentionDays,
            @DefaultValue("24h") Duration cleanupInterval) {
    }

    /**
     * @param includeDetails expose exception messages of unexpected faults to clients
     */
    public record Errors(@DefaultValue("false") boolean includeDetails) {
    }

    public record Tickets(
            @DefaultValue("Normal") String defaultPriority,
            @DefaultValue("50") int defaultPageSize) {
    }
}
