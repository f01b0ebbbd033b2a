package com.scholary.subtitle.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for object storage.
 *
 * <p>These map to the "objectstore.*" keys in application.yml. When {@code enabled} is false no
 * client is created and {@code s3://} destinations are rejected.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    boolean enabled,
    String endpoint,
    String accessKey,
    String secretKey,
    String region,
    boolean pathStyleAccess) {}
