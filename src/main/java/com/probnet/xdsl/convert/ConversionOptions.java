package com.probnet.xdsl.convert;

import lombok.Data;

/**
 * Caller-tunable settings of a conversion.
 */
@Data
public final class ConversionOptions {
    /** Multiply utility tables by the weights of referencing MAU nodes. */
    private boolean applyMauWeights = true;
    /** Emit a comment line above each node of the script. */
    private boolean includeComments = true;
    /** Python variable that holds the diagram in the script. */
    private String diagramVariable = "diag";
}
