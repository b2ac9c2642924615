package com.maestro.core.model;

/**
 * Backing-model capability class, exposed to users under its role name.
 */
public enum ModelTier {
    REASONING("opus"),
    BALANCED("sonnet"),
    FAST("haiku");

    private final String tierKey;

    ModelTier(String tierKey) {
        this.tierKey = tierKey;
    }

    /** Key used for this tier in the model manifest. */
    public String tierKey() {
        return tierKey;
    }

    /** User-facing role name: reasoning, balanced or fast. */
    public String roleName() {
        return name().toLowerCase();
    }

    /** The mid tier, assumed present as last resort. */
    public static ModelTier mid() {
        return BALANCED;
    }

    public static ModelTier fromTierKey(String key) {
        for (ModelTier t : values()) {
            if (t.tierKey.equalsIgnoreCase(key) || t.name().equalsIgnoreCase(key)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown model tier: " + key);
    }
}
