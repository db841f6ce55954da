package com.sentimentfusion.sentiment.client;

import reactor.core.publisher.Mono;

/**
 * One remote text-generation call. Returns the model's reply text; errors on transport or
 * HTTP failure. Implementations never retry.
 */
public interface InferenceClient {

    Mono<String> complete(String model, String prompt);
}
