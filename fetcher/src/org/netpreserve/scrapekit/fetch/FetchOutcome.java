package org.netpreserve.scrapekit.fetch;

import org.jetbrains.annotations.Nullable;

/**
 * What happened to one request handed to the scheduler: exactly one of result and error is set.
 */
public record FetchOutcome(FetchRequest request, @Nullable FetchResult result, @Nullable Exception error) {
    public FetchOutcome {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result and error must be set");
        }
    }

    public static FetchOutcome success(FetchRequest request, FetchResult result) {
        return new FetchOutcome(request, result, null);
    }

    public static FetchOutcome failure(FetchRequest request, Exception error) {
        return new FetchOutcome(request, null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public FetchStatus status() {
        if (result != null) return result.status();
        if (error instanceof FetchException fetchException) return fetchException.status();
        return FetchStatus.NETWORK_ERROR;
    }
}
