package org.netpreserve.scrapekit.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;
import org.netpreserve.scrapekit.cdp.protocol.Unwrap;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

public interface Page {
    Navigate navigate(String url);

    void enable();

    void setLifecycleEventsEnabled(boolean enabled);

    @Unwrap("frameTree")
    FrameTree getFrameTree();

    void onLifecycleEvent(Consumer<LifecycleEvent> handler);

    void onFrameStartedLoading(Consumer<FrameStartedLoading> handler);

    void onFrameStoppedLoading(Consumer<FrameStoppedLoading> handler);

    record LifecycleEvent(FrameId frameId, Network.LoaderId loaderId, String name, double timestamp) {
    }

    record FrameStartedLoading(FrameId frameId) {
    }

    record FrameStoppedLoading(FrameId frameId) {
    }

    record FrameId(@JsonValue String value) {
        @JsonCreator
        public FrameId {
            Objects.requireNonNull(value);
        }
    }

    record FrameTree(Frame frame, List<FrameTree> childFrames) {
    }

    record Frame(@NotNull FrameId id, FrameId parentId, @NotNull Network.LoaderId loaderId, String name,
                 @NotNull String url) {
    }

    /**
     * Result of {@link #navigate}. {@code loaderId} is null for same-document navigations and
     * {@code errorText} is set when the navigation failed outright (DNS, connection refused, etc).
     */
    record Navigate(FrameId frameId, Network.LoaderId loaderId, String errorText) {
    }
}
