package com.sentimentfusion.common.exception;

import com.sentimentfusion.common.error.ProviderErrorCode;
import com.sentimentfusion.common.model.NewsProvider;

/**
 * Raised by a content provider client. Caught by the fetcher and recorded as a
 * {@link com.sentimentfusion.common.model.ProviderError}; never propagated past the fetch stage.
 */
public class ProviderException extends RuntimeException {

    private final NewsProvider provider;
    private final ProviderErrorCode kind;
    private final Integer httpStatus;

    public ProviderException(NewsProvider provider, ProviderErrorCode kind, String message, Integer httpStatus) {
        super("[" + provider.displayName() + "] " + message);
        this.provider   = provider;
        this.kind       = kind;
        this.httpStatus = httpStatus;
    }

    public ProviderException(NewsProvider provider, ProviderErrorCode kind, String message) {
        this(provider, kind, message, null);
    }

    public NewsProvider getProvider() {
        return provider;
    }

    public ProviderErrorCode getKind() {
        return kind;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
