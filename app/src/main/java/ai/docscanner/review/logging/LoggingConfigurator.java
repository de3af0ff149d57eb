package ai.docscanner.review.logging;

import ai.docscanner.review.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Iterator;
import org.slf4j.LoggerFactory;

/**
 * Applies the chosen log format to every stream appender of the root logger and, in verbose mode, opens the
 * review engine's loggers up to DEBUG. Those carry the per-run diagnostics: dropped blocks and sentences,
 * discarded cross-block findings, unplaced issues and stage progress.
 */
public final class LoggingConfigurator {

    static final String ENGINE_LOGGER = "ai.docscanner.review";
    static final String TEXT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %X{runId} %logger{36} - %msg%n";

    private LoggingConfigurator() {
    }

    public static void configure(LogFormat format, boolean verbose) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        if (verbose) {
            context.getLogger(ENGINE_LOGGER).setLevel(Level.DEBUG);
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        for (Iterator<Appender<ILoggingEvent>> iterator = root.iteratorForAppenders(); iterator.hasNext(); ) {
            if (iterator.next() instanceof OutputStreamAppender<ILoggingEvent> appender) {
                replaceEncoder(appender, encoderFor(format, context));
            }
        }
    }

    /**
     * A fresh encoder per appender; logback encoders are bound to the stream of the appender that starts them.
     */
    static Encoder<ILoggingEvent> encoderFor(LogFormat format, LoggerContext context) {
        Encoder<ILoggingEvent> encoder = switch (format) {
            case JSON -> {
                SimpleJsonLayout layout = new SimpleJsonLayout();
                layout.setContext(context);
                layout.start();
                LayoutWrappingEncoder<ILoggingEvent> wrapping = new LayoutWrappingEncoder<>();
                wrapping.setLayout(layout);
                yield wrapping;
            }
            case TEXT -> {
                PatternLayoutEncoder pattern = new PatternLayoutEncoder();
                pattern.setPattern(TEXT_PATTERN);
                yield pattern;
            }
        };
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }

    private static void replaceEncoder(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (running) {
            appender.start();
        }
    }
}
