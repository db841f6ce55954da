package com.sentimentfusion.common.exception;

import com.sentimentfusion.common.model.ModelRole;

/**
 * Failure of a remote sentiment model call. Adapters convert it into a failed
 * {@link com.sentimentfusion.common.model.ModelResult}.
 */
public class ModelInvocationException extends RuntimeException {

    private final String detail;

    public ModelInvocationException(ModelRole role, String message) {
        super("[" + role.key() + "] " + message);
        this.detail = message;
    }

    /** The message without the role prefix. */
    public String getDetail() {
        return detail;
    }
}
