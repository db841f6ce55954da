package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The two independent model opinions for one symbol, keyed by role.
 */
public record ModelPair(
    @JsonProperty("a") ModelResult modelA,
    @JsonProperty("b") ModelResult modelB
) {
    @JsonIgnore
    public int successfulModels() {
        int count = 0;
        if (modelA != null && modelA.isValid()) count++;
        if (modelB != null && modelB.isValid()) count++;
        return count;
    }

    /** Both models failed on the remote side (rate limit, timeout, transport), not for lack of input. */
    @JsonIgnore
    public boolean bothFailedRemotely() {
        return modelA != null && modelB != null
            && modelA.isRemoteFailure() && modelB.isRemoteFailure();
    }
}
