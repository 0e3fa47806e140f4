package org.netpreserve.scrapekit.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Request interception. Used here only to answer proxy authentication challenges.
 */
public interface Fetch {
    void enable(List<RequestPattern> patterns, Boolean handleAuthRequests);

    void onRequestPaused(Consumer<RequestPaused> handler);

    void onAuthRequired(Consumer<AuthRequired> handler);

    CompletionStage<Void> continueRequestAsync(RequestId requestId);

    CompletionStage<Void> continueWithAuthAsync(RequestId requestId, AuthChallengeResponse authChallengeResponse);

    record RequestId(@JsonValue String value) {
        @JsonCreator
        public RequestId {
            Objects.requireNonNull(value);
        }
    }

    record RequestPattern(String urlPattern) {
    }

    record RequestPaused(RequestId requestId, Page.FrameId frameId) {
    }

    record AuthRequired(RequestId requestId, AuthChallenge authChallenge) {
    }

    record AuthChallenge(String source, String origin, String scheme, String realm) {
    }

    /**
     * @param response one of {@code Default}, {@code CancelAuth} or {@code ProvideCredentials}
     */
    record AuthChallengeResponse(String response, String username, String password) {
        public static AuthChallengeResponse provide(String username, String password) {
            return new AuthChallengeResponse("ProvideCredentials", username, password);
        }

        public static AuthChallengeResponse cancel() {
            return new AuthChallengeResponse("CancelAuth", null, null);
        }
    }
}
