package com.example.bugservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the bug read-through cache.
 */
@ConfigurationProperties(prefix = "bugservice.cache")
@Getter
@Setter
public class BugCacheProperties {

    /**
     * Use Redis; when false a no-op cache is wired and every read goes to the database.
     */
    private boolean enabled = true;

    /**
     * Time to live of a cached single bug.
     */
    private Duration bugTtl = Duration.ofMinutes(30);

    /**
     * Time to live of a cached first list page.
     */
    private Duration listTtl = Duration.ofMinutes(5);
}
