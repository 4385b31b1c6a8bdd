package org.postevent.lookup.util;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;

import static ch.qos.logback.classic.Level.*;
import static ch.qos.logback.core.pattern.color.ANSIConstants.*;

/**
 * Colours console log levels. Registered as {@code %highlightLevel} in logback.xml.
 */
public class LogHighlighter extends ForegroundCompositeConverterBase<ILoggingEvent> {
    @Override
    protected String getForegroundColorCode(ILoggingEvent event) {
        return switch (event.getLevel().toInt()) {
            case ERROR_INT -> BOLD + RED_FG;
            case WARN_INT -> YELLOW_FG;
            case INFO_INT -> GREEN_FG;
            case TRACE_INT -> BLUE_FG;
            default -> DEFAULT_FG;
        };
    }
}
