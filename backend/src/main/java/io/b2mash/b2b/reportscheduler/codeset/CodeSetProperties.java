package io.b2mash.b2b.reportscheduler.codeset;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the classpath-backed code set source.
 *
 * @param location resource pattern matching the code set pack files
 */
@ConfigurationProperties(prefix = "reportscheduler.code-sets")
public record CodeSetProperties(@DefaultValue("classpath:code-sets/*.json") String location) {}
