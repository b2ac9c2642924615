package com.maestro.core.model;

import java.io.Serializable;

/**
 * Concrete model id behind a tier, and whether it is currently available.
 */
public record TierInfo(String id, boolean available) implements Serializable {}
