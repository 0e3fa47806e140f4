package org.netpreserve.scrapekit.cdp;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scrapekit.cdp.domains.Browser;
import org.netpreserve.scrapekit.cdp.domains.Network;
import org.netpreserve.scrapekit.cdp.domains.Storage;
import org.netpreserve.scrapekit.cdp.domains.Target;
import org.netpreserve.scrapekit.cdp.protocol.CDPClient;
import org.netpreserve.scrapekit.cdp.protocol.CDPSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.ProcessBuilder.Redirect.*;
import static java.util.stream.Collectors.joining;

/**
 * A locally launched Chrome or Chromium instance driven over the DevTools protocol.
 * <p>
 * Each caller normally works inside its own browser context (see {@link #createContext(String)}) so cookies
 * and cache are not shared between sessions that happen to use the same browser.
 */
public class BrowserProcess implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserProcess.class);
    private static final List<String> BROWSER_EXECUTABLES = List.of(
            "chromium-browser",
            "chromium",
            "google-chrome",
            "google-chrome-stable",
            "chrome",
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome",
            "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe",
            "C:\\Program Files\\Google\\Chrome\\Application\\chrome.exe");

    private final Process process;
    private final CDPClient cdp;
    private final Browser browser;
    private final Target target;
    private final Storage storage;
    private final Thread shutdownHook;
    private final AtomicBoolean closed = new AtomicBoolean();
    private Browser.Version version;

    BrowserProcess(Process process, CDPClient cdp) {
        this.process = process;
        this.cdp = cdp;
        this.browser = cdp.domain(Browser.class);
        this.target = cdp.domain(Target.class);
        this.storage = cdp.domain(Storage.class);
        this.shutdownHook = new Thread(this::destroyProcess, "browser-shutdown");
        java.lang.Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    /**
     * Launches a browser.
     *
     * @param executable browser binary, or null to search the usual install locations
     * @param options    extra command-line options
     * @param headless   run without a visible window
     */
    public static BrowserProcess start(@Nullable String executable, List<String> options, boolean headless)
            throws IOException {
        if (executable == null) {
            executable = findExecutable().orElseThrow(() ->
                    new IOException("Couldn't find a Chrome or Chromium executable. Set browser.executable"));
        }
        Path profileDir = Files.createTempDirectory("scrapekit-profile-");
        var command = new ArrayList<>(List.of(executable,
                "--no-default-browser-check",
                "--no-first-run",
                "--no-startup-window",
                "--disable-search-engine-choice-screen",
                "--disable-background-networking",
                "--disable-background-timer-throttling",
                "--disable-backgrounding-occluded-windows",
                "--disable-renderer-backgrounding",
                "--disable-sync",
                "--use-mock-keychain",
                "--user-data-dir=" + profileDir,
                "--disable-blink-features=AutomationControlled",
                "--window-size=1920,1080"));
        if (headless) {
            command.add("--headless=new");
            command.add("--disable-gpu");
        }
        if (options != null) command.addAll(options);

        boolean pipeMode = Files.isExecutable(Path.of("/bin/sh"));
        Process process;
        if (pipeMode) {
            // The browser reads CDP from FD 3 and writes to FD 4. Java can't hand a child arbitrary FDs,
            // so the shell moves our stdin/stdout onto them.
            command.add(1, "--remote-debugging-pipe");
            String escapedCommand = command.stream().map(BrowserProcess::singleQuote).collect(joining(" "));
            String cleanup = "rm -rf " + singleQuote(profileDir.toString()) + " 2>/dev/null";
            process = new ProcessBuilder("/bin/sh", "-c",
                    "trap " + singleQuote(cleanup) + " EXIT; " + escapedCommand + " 3<&0 4>&1 0<&- 1>&2")
                    .redirectError(INHERIT)
                    .redirectOutput(PIPE)
                    .redirectInput(PIPE)
                    .start();
        } else {
            command.add(1, "--remote-debugging-port=0");
            process = new ProcessBuilder(command)
                    .redirectOutput(DISCARD)
                    .redirectError(PIPE)
                    .start();
        }
        log.atDebug().addKeyValue("executable", executable).addKeyValue("pipe", pipeMode)
                .log("Started browser pid {}", process.pid());
        try {
            CDPClient client = pipeMode ?
                    new CDPClient(process.getInputStream(), process.getOutputStream()) :
                    new CDPClient(readDevtoolsUrl(process));
            return new BrowserProcess(process, client);
        } catch (IOException | RuntimeException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    /**
     * Searches PATH and the usual install locations for a Chrome or Chromium binary.
     */
    public static Optional<String> findExecutable() {
        String path = System.getenv("PATH");
        for (var executable : BROWSER_EXECUTABLES) {
            if (executable.contains(File.separator) || executable.contains("/")) {
                if (Files.isExecutable(Path.of(executable))) return Optional.of(executable);
                continue;
            }
            if (path == null) continue;
            for (var dir : path.split(File.pathSeparator)) {
                if (dir.isEmpty()) continue;
                Path candidate = Path.of(dir, executable);
                if (Files.isExecutable(candidate)) return Optional.of(candidate.toString());
            }
        }
        return Optional.empty();
    }

    private static String singleQuote(String string) {
        return "'" + string.replace("'", "'\\''") + "'";
    }

    private static URI readDevtoolsUrl(Process process) throws IOException {
        var future = new CompletableFuture<URI>();
        var thread = new Thread(() -> {
            var prefix = "DevTools listening on ";
            try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(),
                    StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.startsWith(prefix)) {
                        future.complete(URI.create(line.substring(prefix.length())));
                    }
                    log.debug("Browser: {}", line);
                }
                future.completeExceptionally(new IOException("Browser exited before listening"));
            } catch (IOException e) {
                future.completeExceptionally(e);
            }
        }, "browser-stderr");
        thread.setDaemon(true);
        thread.start();
        try {
            return future.get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted waiting for browser devtools URL", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Browser did not report a devtools URL", e);
        }
    }

    /**
     * Creates an isolated browser context.
     *
     * @param proxyServer proxy for all requests from the context (e.g. {@code http://proxy:3128}), or null
     * @return the context id
     */
    public String createContext(@Nullable String proxyServer) {
        return target.createBrowserContext(true, proxyServer, null);
    }

    public void disposeContext(String browserContextId) {
        target.disposeBrowserContext(browserContextId);
    }

    /**
     * Opens a new blank tab inside the given context and attaches to it.
     */
    public BrowserTab newTab(String browserContextId) {
        String targetId = target.createTarget("about:blank", browserContextId);
        String sessionId = target.attachToTarget(targetId, true);
        return new BrowserTab(new CDPSession(cdp, sessionId, targetId));
    }

    public List<Network.Cookie> cookies(String browserContextId) {
        return storage.getCookies(browserContextId);
    }

    public void setCookies(String browserContextId, List<Network.CookieParam> cookies) {
        storage.setCookies(cookies, browserContextId);
    }

    public void clearCookies(String browserContextId) {
        storage.clearCookies(browserContextId);
    }

    public Browser.Version version() {
        if (version == null) {
            this.version = browser.getVersion();
        }
        return version;
    }

    /**
     * Registers a callback for when the browser exits or the DevTools connection drops.
     */
    public void onDisconnect(Runnable listener) {
        cdp.onDisconnect(listener);
    }

    public boolean isAlive() {
        return !closed.get() && !cdp.isClosed() && process.isAlive();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            java.lang.Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // already shutting down, the hook will run anyway
        }
        cdp.close();
        destroyProcess();
    }

    private void destroyProcess() {
        try {
            // in pipe mode the browser exits by itself once the pipe closes, letting the shell remove the profile
            if (process.waitFor(2, TimeUnit.SECONDS)) return;
            process.destroy();
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }
}
