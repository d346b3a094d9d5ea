package org.omicsfusion.tools.integration;

import org.omicsfusion.utils.Utils;

import java.util.Objects;

/**
 * Record of a requested dimensionality that was lowered to the largest one the data allows.
 */
public final class DimensionalityClamp {

    /**
     * Stage name used for the reduction of the concatenated latent representations.
     */
    public static final String JOINT_STAGE = "joint";

    private final String stage;
    private final int requestedNumComponents;
    private final int effectiveNumComponents;

    public DimensionalityClamp(final String stage, final int requestedNumComponents, final int effectiveNumComponents) {
        this.stage = Utils.nonEmpty(stage, "the stage name cannot be null or empty");
        Utils.validateArg(effectiveNumComponents < requestedNumComponents,
                () -> String.format("a clamp must lower the dimensionality: %d -> %d", requestedNumComponents, effectiveNumComponents));
        this.requestedNumComponents = requestedNumComponents;
        this.effectiveNumComponents = effectiveNumComponents;
    }

    /**
     * Returns the modality name, or {@link #JOINT_STAGE}.
     */
    public String getStage() {
        return stage;
    }

    public int getRequestedNumComponents() {
        return requestedNumComponents;
    }

    public int getEffectiveNumComponents() {
        return effectiveNumComponents;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final DimensionalityClamp that = (DimensionalityClamp) o;
        return requestedNumComponents == that.requestedNumComponents
                && effectiveNumComponents == that.effectiveNumComponents
                && stage.equals(that.stage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, requestedNumComponents, effectiveNumComponents);
    }

    @Override
    public String toString() {
        return String.format("%s: %d -> %d components", stage, requestedNumComponents, effectiveNumComponents);
    }
}
