package org.netpreserve.scrapekit.cdp.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Proxy;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.*;
import java.util.function.Consumer;

/**
 * Common command and event plumbing for the browser-level client and per-target sessions.
 * <p>
 * Domain interfaces are turned into proxies by {@link #domain(Class)}: a method {@code Page.navigate(String url)}
 * sends the command {@code Page.navigate} with params {@code {"url": ...}}, and a method
 * {@code onLifecycleEvent(Consumer<LifecycleEvent>)} subscribes to the event {@code Page.lifecycleEvent}.
 * Methods returning a {@link CompletionStage} don't block and may be called from event handlers.
 */
public abstract class CDPBase {
    private static final Logger log = LoggerFactory.getLogger(CDPBase.class);
    private static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(60);
    private final Map<Long, CompletableFuture<JsonNode>> commands = new ConcurrentHashMap<>();
    private final Map<String, Consumer<JsonNode>> listeners = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private volatile Thread executorThread;
    private volatile Duration commandTimeout = DEFAULT_COMMAND_TIMEOUT;
    private volatile boolean closed;

    protected CDPBase() {
        String parentThreadName = Thread.currentThread().getName();
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, parentThreadName + "-CDP");
            thread.setDaemon(true);
            executorThread = thread;
            return thread;
        });
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    public <T> T domain(Class<T> domainInterface) {
        return (T) Proxy.newProxyInstance(domainInterface.getClassLoader(), new Class[]{domainInterface},
                (proxy, method, args) -> {
                    if (method.getDeclaringClass() == Object.class) {
                        return switch (method.getName()) {
                            case "equals" -> proxy == args[0];
                            case "hashCode" -> System.identityHashCode(proxy);
                            default -> domainInterface.getSimpleName() + "@" + System.identityHashCode(proxy);
                        };
                    }
                    var methodParameters = method.getParameters();
                    if (method.getName().startsWith("on") && methodParameters.length == 1
                        && methodParameters[0].getType() == Consumer.class) {
                        var type = (ParameterizedType) method.getGenericParameterTypes()[0];
                        var eventClass = (Class<?>) type.getActualTypeArguments()[0];
                        addListener(eventClass, (Consumer) args[0]);
                        return null;
                    }
                    var params = new LinkedHashMap<String, Object>(methodParameters.length);
                    for (int i = 0; i < methodParameters.length; i++) {
                        if (args[i] != null) params.put(methodParameters[i].getName(), args[i]);
                    }
                    return sendCommand(domainInterface.getSimpleName() + "." + method.getName(), params,
                            method.getGenericReturnType(), method.getAnnotation(Unwrap.class));
                });
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    protected void handleMessage(RPC.ServerMessage message) {
        try {
            executor.submit(() -> {
                if (message instanceof RPC.Event event) {
                    handleEvent(event);
                } else if (message instanceof RPC.Response response) {
                    handleResponse(response);
                } else {
                    log.error("Unknown message type: {}", message);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Dropping message, session is closing", e);
        }
    }

    private void handleResponse(RPC.Response response) {
        var future = commands.remove(response.id());
        if (future == null) {
            log.warn("Received response to unknown call id {}", response.id());
        } else if (response.error() == null) {
            future.complete(response.result());
        } else {
            future.completeExceptionally(new CDPException(response.error().code(), response.error().message()));
        }
    }

    private void handleEvent(RPC.Event event) {
        if (log.isTraceEnabled()) {
            log.trace("{} {}", event.method(), RPC.abbreviate(String.valueOf(event.params())));
        }
        Consumer<JsonNode> handler = listeners.get(event.method());
        if (handler != null) {
            try {
                handler.accept(event.params());
            } catch (Exception e) {
                log.error("{} handler threw", event.method(), e);
            }
        }
    }

    static String eventName(Class<?> eventClass) {
        String className = eventClass.getSimpleName();
        return eventClass.getEnclosingClass().getSimpleName() + "." + lowercaseFirstLetter(className);
    }

    public <T> void addListener(Class<T> eventClass, Consumer<T> callback) {
        listeners.put(eventName(eventClass), params -> {
            try {
                callback.accept(RPC.JSON.treeToValue(params, eventClass));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    Object sendCommand(String method, Map<String, Object> params, Type returnType, Unwrap unwrap) {
        Type valueType = returnType;
        boolean returnsCompletionStage = false;
        if (returnType instanceof ParameterizedType parameterizedType &&
            CompletionStage.class.isAssignableFrom((Class<?>) parameterizedType.getRawType())) {
            valueType = parameterizedType.getActualTypeArguments()[0];
            returnsCompletionStage = true;
        }
        if (!returnsCompletionStage && Thread.currentThread() == executorThread) {
            throw new IllegalStateException("Sending " + method + " on the event handler thread would deadlock");
        }
        if (method.endsWith("Async")) {
            method = method.substring(0, method.length() - "Async".length());
        }
        if (closed) throw new CDPClosedException();

        long commandId = nextCommandId();
        var future = new CompletableFuture<JsonNode>();
        commands.put(commandId, future);
        if (log.isTraceEnabled()) {
            log.trace("[{}] {} {}", commandId, method, RPC.abbreviate(String.valueOf(params)));
        }

        boolean leaveCommandInMap = false;
        try {
            sendCommandMessage(commandId, method, params);
            Type resultType = valueType;
            CompletableFuture<Object> mapped = future.thenApply(result -> mapResult(result, resultType, unwrap));
            if (returnsCompletionStage) {
                leaveCommandInMap = true;
                return mapped;
            }
            return mapped.get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CDPException cdpException) {
                cdpException.actuallyFillInStackTrace();
                throw cdpException;
            } else if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            } else {
                throw new CDPException(0, method + " failed: " + e.getCause());
            }
        } catch (TimeoutException e) {
            throw new CDPTimeoutException("Timed out after " + commandTimeout.toMillis() + " ms waiting for " + method);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CDPInterruptedException(method);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            if (!leaveCommandInMap) commands.remove(commandId);
        }
    }

    private static Object mapResult(JsonNode result, Type valueType, Unwrap unwrap) {
        if (valueType == void.class || valueType == Void.class) return null;
        JsonNode node = unwrap == null ? result : result.get(unwrap.value());
        if (node == null || node.isNull()) return null;
        try {
            return RPC.JSON.treeToValue(node, RPC.JSON.constructType(valueType));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String lowercaseFirstLetter(String s) {
        return s.substring(0, 1).toLowerCase(Locale.ROOT) + s.substring(1);
    }

    protected abstract void sendCommandMessage(long commandId, String method, Map<String, Object> params) throws IOException;

    protected abstract long nextCommandId();

    public boolean isClosed() {
        return closed;
    }

    protected void close() {
        handleRpcClose();
        executor.shutdown();
    }

    /**
     * Fails every command still waiting for a reply.
     */
    protected void handleRpcClose() {
        closed = true;
        commands.values().forEach(command -> command.completeExceptionally(new CDPClosedException()));
        commands.clear();
    }
}
