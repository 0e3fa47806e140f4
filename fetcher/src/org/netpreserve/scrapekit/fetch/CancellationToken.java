package org.netpreserve.scrapekit.fetch;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Shared flag telling scheduled fetches to give up. Once cancelled it stays cancelled.
 */
public class CancellationToken {
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean cancelled;

    public void cancel() {
        synchronized (this) {
            if (cancelled) return;
            cancelled = true;
        }
        listeners.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled(URI url) throws FetchCancelledException {
        if (cancelled) throw new FetchCancelledException(url, "Cancelled");
    }

    /**
     * Runs the listener on cancellation, or straight away if already cancelled.
     */
    public void onCancel(Runnable listener) {
        synchronized (this) {
            if (!cancelled) {
                listeners.add(listener);
                return;
            }
        }
        listener.run();
    }
}
