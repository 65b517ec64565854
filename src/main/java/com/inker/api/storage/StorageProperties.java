package com.inker.api.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * @param type which backend to use
 * @param directory where the file backend keeps its snapshot
 */
@ConfigurationProperties(prefix = "inker.storage")
public record StorageProperties(@DefaultValue("auto") StorageType type, @DefaultValue("data") Path directory) {
}
