package io.modelprep.prepare.tool;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import io.modelprep.prepare.config.ToolConfig;
import org.slf4j.LoggerFactory;

/**
 * Reconfigures Logback from {@link ToolConfig} once the tool configuration is known.
 *
 * <p>
 * {@code json} uses Logback's {@link JsonEncoder}; {@code text} uses {@link #TEXT_PATTERN}. The
 * root appender writes to standard error so standard output stays free for usage text.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";
    static final String APPENDER_NAME = "CONSOLE";

    private LogbackConfigurator() {
        // utility class
    }

    public static void configure(ToolConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(config.loggingLevel(), Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");

        if (ToolConfig.FORMAT_JSON.equals(config.loggingFormat())) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            appender.setEncoder(encoder);
        } else {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(TEXT_PATTERN);
            encoder.start();
            appender.setEncoder(encoder);
        }

        appender.start();
        rootLogger.addAppender(appender);

        // schema validator logs every keyword lookup at DEBUG
        context.getLogger("com.networknt").setLevel(Level.WARN);
    }
}
