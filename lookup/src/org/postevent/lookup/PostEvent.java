package org.postevent.lookup;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.postevent.cdp.BrowserProcess;
import org.postevent.cdp.protocol.CDPBase;
import org.postevent.lookup.config.ConfigLoader;
import org.postevent.lookup.config.LookupConfig;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Command line entry point: looks up an IPv4 address in every configured source and prints the
 * results as JSON.
 */
public class PostEvent {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(PostEvent.class);
    private static final ObjectMapper JSON = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    public static void main(String[] args) throws Exception {
        Path configFile = null;
        boolean dumpConfig = false;
        String query = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> configFile = Path.of(args[++i]);
                case "--dump-config" -> dumpConfig = true;
                case "--trace-cdp" -> startCdpTraceFile(args[++i]);
                case "--help", "-h" -> {
                    System.out.println("Usage: postevent [options] IPV4-ADDRESS");
                    System.out.println("Options:");
                    System.out.println("  -c, --config FILE        YAML file overriding the default configuration");
                    System.out.println("      --dump-config        Print the effective configuration and exit");
                    System.out.println("  -h, --help");
                    System.out.println("      --trace-cdp FILE     Write CDP trace to file");
                    System.exit(0);
                }
                default -> {
                    if (args[i].startsWith("-")) {
                        System.err.println("Unknown option: " + args[i]);
                        System.exit(1);
                    }
                    if (query != null) {
                        System.err.println("Only one address can be looked up at a time");
                        System.exit(1);
                    }
                    query = args[i].trim();
                }
            }
        }

        LookupConfig config = ConfigLoader.load(configFile);
        if (dumpConfig) {
            System.out.println(ConfigLoader.YAML.writeValueAsString(config));
            System.exit(0);
        }
        if (query == null) {
            System.err.println("Usage: postevent [options] IPV4-ADDRESS");
            System.exit(1);
        }
        if (!Lookup.isValidIpv4(query)) {
            System.err.println("Please enter a valid IPv4 address");
            System.exit(1);
        }

        var extractors = new ArrayList<Extractor>();
        for (var source : config.sources()) {
            extractors.add(new TemplateExtractor(source, config.navigation().toNavigateOptions(),
                    config.navigation().toWaitOptions()));
        }

        var browserConfig = config.browser();
        LookupResult result;
        try (var browser = BrowserProcess.start(browserConfig.executable(), browserConfig.options(), null,
                browserConfig.shell());
             var lookup = new Lookup(extractors, browser::newTab, config.workers())) {
            log.info("Using {}", browser.version().product());
            result = lookup.run(query);
        }
        System.out.println(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.bySource()));
        System.exit(result.successCount() > 0 ? 0 : 2);
    }

    private static void startCdpTraceFile(String file) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        var encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %msg%n");
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
            // keep the console at its previous level
            ThresholdFilter filter = new ThresholdFilter();
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
