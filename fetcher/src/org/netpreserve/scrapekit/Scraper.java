package org.netpreserve.scrapekit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import org.netpreserve.scrapekit.auth.AuthenticationException;
import org.netpreserve.scrapekit.auth.CredentialStore;
import org.netpreserve.scrapekit.auth.FieldMap;
import org.netpreserve.scrapekit.auth.LoginVerifier;
import org.netpreserve.scrapekit.auth.SessionNegotiator;
import org.netpreserve.scrapekit.cdp.protocol.CDPBase;
import org.netpreserve.scrapekit.config.ScraperConfig;
import org.netpreserve.scrapekit.fetch.FetchEngine;
import org.netpreserve.scrapekit.fetch.FetchOutcome;
import org.netpreserve.scrapekit.fetch.FetchRequest;
import org.netpreserve.scrapekit.fetch.FetchScheduler;
import org.netpreserve.scrapekit.fetch.TransportKind;
import org.netpreserve.scrapekit.rate.RateController;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;

public class Scraper {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(Scraper.class);

    public static void main(String[] args) throws Exception {
        Path configFile = null;
        boolean browser = false;
        boolean login = false;
        boolean dumpConfig = false;
        var urls = new ArrayList<String>();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--browser" -> browser = true;
                case "--config", "-c" -> configFile = Path.of(args[++i]);
                case "--dump-config" -> dumpConfig = true;
                case "--login" -> login = true;
                case "--help", "-h" -> {
                    System.out.println("Usage: scrapekit [options] URL...");
                    System.out.println("Options:");
                    System.out.println("  -c, --config FILE        YAML config merged over the defaults");
                    System.out.println("      --browser            Fetch with a headless browser");
                    System.out.println("      --dump-config        Print the effective config and exit");
                    System.out.println("  -h, --help");
                    System.out.println("      --login              Log in before fetching (needs login config)");
                    System.out.println("      --trace-cdp <file>   Write CDP trace to file");
                    System.exit(0);
                }
                case "--trace-cdp" -> startCdpTraceFile(args[++i]);
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    urls.add(args[i]);
                }
            }
        }

        ScraperConfig config;
        try {
            config = ScraperConfig.load(configFile);
        } catch (ConfigurationException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            return;
        }
        if (browser) config = config.withTransport(TransportKind.BROWSER);
        if (dumpConfig) {
            System.out.println(ScraperConfig.yamlMapper().writerWithDefaultPrettyPrinter().writeValueAsString(config));
            System.exit(0);
        }
        if (urls.isEmpty()) {
            System.err.println("No URLs given. Try --help");
            System.exit(1);
        }
        if (login && config.login() == null) {
            System.err.println("--login needs a login section in the config");
            System.exit(1);
        }

        int failures = 0;
        var rateController = new RateController(config.rateLimit());
        try (var engine = new FetchEngine(config, rateController);
             var scheduler = new FetchScheduler(engine, config.workers())) {
            Runtime.getRuntime().addShutdownHook(new Thread(scheduler::cancel, "shutdown-hook"));

            if (login) {
                var loginConfig = config.login();
                var store = CredentialStore.forLogin(loginConfig, true);
                var negotiator = new SessionNegotiator(
                        new LoginVerifier(loginConfig.failurePhrases(), loginConfig.successPhrases()), null);
                negotiator.login(engine, loginConfig.url(), FieldMap.of(loginConfig.fields()), store,
                        loginConfig.credentialsKey());
            }

            var channel = scheduler.fetchAll(urls.stream().map(FetchRequest::of).toList());
            while (channel.hasNext()) {
                FetchOutcome outcome = channel.next();
                if (outcome.isSuccess()) {
                    var result = outcome.result();
                    System.out.println(result.statusCode() + " " + result.finalUrl() + " " +
                                       result.content().length());
                } else {
                    failures++;
                    System.out.println(outcome.status() + " " + outcome.request().url() + " " +
                                       outcome.error().getMessage());
                }
            }
        } catch (AuthenticationException e) {
            log.error("Login failed: {}", e.getMessage());
            System.exit(2);
        } catch (ConfigurationException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
        System.exit(failures == 0 ? 0 : 3);
    }

    private static void startCdpTraceFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss} [%thread] %-5level %msg%n");
        encoder.start();

        var fileAppender = new FileAppender<ILoggingEvent>();
        fileAppender.setContext(context);
        fileAppender.setEncoder(encoder);
        fileAppender.setName("cdp-trace-file");
        fileAppender.setFile(file);
        fileAppender.start();

        var logger = (Logger) LoggerFactory.getLogger(CDPBase.class);
        logger.addAppender(fileAppender);
        if (logger.getEffectiveLevel().toInteger() != Level.TRACE_INT) {
            // keep the trace out of the console
            var filter = new ThresholdFilter();
            filter.setLevel(logger.getEffectiveLevel().toString());
            filter.start();
            var stdoutAppender = (ConsoleAppender<ILoggingEvent>) context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .getAppender("STDOUT");
            if (stdoutAppender != null) {
                stdoutAppender.stop();
                stdoutAppender.addFilter(filter);
                stdoutAppender.start();
            }
            logger.setLevel(Level.TRACE);
        }
    }
}
