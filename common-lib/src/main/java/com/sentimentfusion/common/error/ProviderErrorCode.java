package com.sentimentfusion.common.error;

import com.sentimentfusion.common.model.NewsProvider;

/**
 * Failure kinds a content provider can report. The wire code is {@code <PROVIDER>_<KIND>},
 * e.g. {@code FEED_A_RATE_LIMIT}.
 */
public enum ProviderErrorCode {

    RATE_LIMIT,
    QUOTA_EXCEEDED,
    INVALID_KEY,
    NOT_FOUND,
    TIMEOUT,
    SERVER_ERROR,
    NOT_CONFIGURED,
    EMPTY_RESULT,
    UNKNOWN;

    public String codeFor(NewsProvider provider) {
        return provider.codePrefix() + "_" + name();
    }

    /** Kind implied by an HTTP status; {@code null} for non-error statuses. */
    public static ProviderErrorCode fromHttpStatus(int status) {
        if (status == 429)                 return RATE_LIMIT;
        if (status == 401 || status == 403) return INVALID_KEY;
        if (status == 404)                 return NOT_FOUND;
        if (status == 408 || status == 504) return TIMEOUT;
        if (status >= 500)                 return SERVER_ERROR;
        if (status >= 400)                 return UNKNOWN;
        return null;
    }
}
