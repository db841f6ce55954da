package com.sentimentfusion.news.error;

import com.sentimentfusion.common.error.ProviderErrorCode;
import com.sentimentfusion.common.error.ProviderErrors;
import com.sentimentfusion.common.exception.ProviderException;
import com.sentimentfusion.common.model.NewsProvider;
import com.sentimentfusion.common.model.ProviderError;
import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Turns whatever a provider call failed with into a typed {@link ProviderError}.
 *
 * <p>Order: {@link ProviderException} (the client already knows the kind), HTTP status from
 * {@link WebClientResponseException}, timeouts anywhere in the cause chain, then message heuristics.
 */
public final class ProviderErrorClassifier {

    private ProviderErrorClassifier() {}

    public static ProviderError fromThrowable(NewsProvider provider, Throwable error, long timeoutMs) {
        if (error instanceof ProviderException pe) {
            return ProviderErrors.create(pe.getProvider(), pe.getKind(), pe.getMessage(), pe.getHttpStatus());
        }
        if (error instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            ProviderErrorCode kind = ProviderErrorCode.fromHttpStatus(status);
            return ProviderErrors.create(provider, kind == null ? ProviderErrorCode.UNKNOWN : kind,
                provider.displayName() + ": HTTP " + status + " " + wcre.getStatusText(), status);
        }
        if (isTimeout(error)) {
            return ProviderErrors.timeout(provider, timeoutMs);
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return ProviderErrors.fromMessage(provider, message);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof ReadTimeoutException) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }
}
