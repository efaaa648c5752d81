package com.openforge.memkeep.llm;

/**
 * Why a reasoning call is being made.
 *
 * The purpose picks the model and temperature.  It does not change scheduling,
 * with one exception: foreground purposes (INFERENCE and its image variant
 * VISION) are single-flight (see InferenceLock) and degrade to a user-visible
 * apology instead of an empty string.
 */
public enum InferencePurpose {

    /** Foreground user-facing answer. */
    INFERENCE(0.7, false),

    /** YES/NO style gating, e.g. the intake valve. */
    CLASSIFICATION(0.1, true),

    /** Structured analysis: sifting, graph extraction, graph analysis. */
    ANALYTICAL(0.1, true),

    /** Autonomous background cycle. */
    HEARTBEAT(0.1, false),

    /** Image understanding on the vision model. */
    VISION(0.7, false);

    private final double  temperature;
    private final boolean sifterModel;

    InferencePurpose(double temperature, boolean sifterModel) {
        this.temperature = temperature;
        this.sifterModel = sifterModel;
    }

    public double temperature() {
        return temperature;
    }

    /** True when this purpose runs on the cheaper sifter model. */
    public boolean usesSifterModel() {
        return sifterModel;
    }

    /** Foreground calls answer a user directly. */
    public boolean isForeground() {
        return this == INFERENCE || this == VISION;
    }
}
