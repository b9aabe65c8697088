package com.comparo.core.model;

import java.io.Serializable;

/**
 * Catalog entry for a model that can take part in a comparison.
 * Sampling settings are nullable; null means the provider default.
 */
public record TargetDescriptor(
    String id,
    String name,
    String provider,
    Double temperature,
    Integer maxTokens,
    Double topP
) implements Serializable {}
