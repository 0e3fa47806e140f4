package org.netpreserve.scrapekit.fetch;

import org.netpreserve.scrapekit.ConfigurationException;
import org.netpreserve.scrapekit.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs many fetches on a pool of worker threads. Pacing still comes from the engines' {@link
 * org.netpreserve.scrapekit.rate.RateController}; the pool only bounds how many threads wait on it.
 * <p>
 * Requests go to the engine for their transport hint, or to the first engine when they have none. The engines
 * belong to the caller and are never closed here.
 */
public class FetchScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetchScheduler.class);

    private final FetchEngine defaultEngine;
    private final Map<TransportKind, FetchEngine> engines = new EnumMap<>(TransportKind.class);
    private final ExecutorService executor;
    private final CancellationToken token;

    public FetchScheduler(FetchEngine engine, int workers) {
        this(List.of(engine), workers, new CancellationToken());
    }

    /**
     * @param engines at most one per transport kind, the first handles requests without a hint
     */
    public FetchScheduler(Collection<FetchEngine> engines, int workers, CancellationToken token) {
        if (engines.isEmpty()) throw new IllegalArgumentException("At least one engine is required");
        if (workers <= 0) throw new IllegalArgumentException("workers must be positive");
        for (FetchEngine engine : engines) {
            if (this.engines.putIfAbsent(engine.transportKind(), engine) != null) {
                throw new IllegalArgumentException("More than one " + engine.transportKind() + " engine");
            }
        }
        this.defaultEngine = engines.iterator().next();
        this.executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory("fetch-worker"));
        this.token = token;
        token.onCancel(this::abandonQueued);
    }

    public CancellationToken token() {
        return token;
    }

    /**
     * Queues one fetch.
     *
     * @return a future completing with the result, or failing with the {@link FetchException} wrapped in an
     * {@link java.util.concurrent.ExecutionException}
     * @throws ConfigurationException if no engine has the transport the request asks for
     */
    public Future<FetchResult> submit(FetchRequest request) {
        FetchEngine engine = engineFor(request);
        return executor.submit(() -> run(engine, request));
    }

    /**
     * Queues a batch of fetches.
     *
     * @return channel yielding one outcome per request as each finishes
     * @throws ConfigurationException if no engine has the transport one of the requests asks for
     */
    public ResultChannel fetchAll(List<FetchRequest> requests) {
        var routed = requests.stream().map(this::engineFor).toList();
        var channel = new ResultChannel(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            FetchRequest request = requests.get(i);
            FetchEngine engine = routed.get(i);
            try {
                executor.execute(() -> channel.deliver(outcomeOf(engine, request)));
            } catch (RejectedExecutionException e) {
                channel.deliver(FetchOutcome.failure(request,
                        new FetchCancelledException(engine.baseUrl(), "Scheduler is shut down", e)));
            }
        }
        log.atDebug().addKeyValue("requests", requests.size()).log("Queued batch");
        return channel;
    }

    private FetchOutcome outcomeOf(FetchEngine engine, FetchRequest request) {
        try {
            return FetchOutcome.success(request, run(engine, request));
        } catch (FetchException | RuntimeException e) {
            return FetchOutcome.failure(request, e);
        }
    }

    private FetchResult run(FetchEngine engine, FetchRequest request) throws FetchException {
        token.throwIfCancelled(request.resolve(engine.baseUrl()));
        return engine.fetch(request);
    }

    private FetchEngine engineFor(FetchRequest request) {
        if (request.transportHint() == null) return defaultEngine;
        FetchEngine engine = engines.get(request.transportHint());
        if (engine == null) {
            throw new ConfigurationException("No " + request.transportHint() + " engine for " + request.url());
        }
        return engine;
    }

    /**
     * Cancels queued fetches and interrupts running ones. Each of them still yields a cancelled outcome.
     */
    public void cancel() {
        token.cancel();
    }

    private void abandonQueued() {
        List<Runnable> queued = executor.shutdownNow();
        log.atInfo().addKeyValue("queued", queued.size()).log("Fetches cancelled");
        // the token is set, so each of these completes straight away with a cancelled outcome
        queued.forEach(Runnable::run);
    }

    /**
     * Lets queued fetches finish, then stops the workers.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Waiting for fetch workers to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
    }
}
