package com.star.logexplorer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.ZoneId;

/**
 * Typed binding for the {@code log-explorer.*} settings.
 */
@Configuration
@ConfigurationProperties(prefix = "log-explorer")
@Data
public class LogExplorerProperties {

    /** Directory holding the log files to query */
    private String directory = "./logs";

    /** Zone for timestamps without an offset and for whole-day date bounds */
    private String zone = "UTC";

    private DataSize maxUploadSize = DataSize.ofMegabytes(50);

    public Path getDirectoryPath() {
        return Path.of(directory);
    }

    public ZoneId getZoneId() {
        return ZoneId.of(zone);
    }
}
