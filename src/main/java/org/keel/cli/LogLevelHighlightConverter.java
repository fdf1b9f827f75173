package org.keel.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Colors the wrapped pattern by event level for the {@code STDERR} appender, which is selected by
 * {@code logging.format = COLOR}.
 *
 * <pre>%levelColor(%-5level)            standard palette
 * %levelColor(%-5level){bright}    high-intensity palette for dark terminals</pre>
 *
 * ERROR is bold red, WARN yellow, INFO blue, DEBUG gray. TRACE is printed as is.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String BRIGHT_OPTION = "bright";

    private static final String ESC = "\u001B[";
    private static final String RESET = ESC + "0m";

    private boolean bright;

    @Override
    public void start() {
        bright = BRIGHT_OPTION.equalsIgnoreCase(getFirstOption());
        super.start();
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String code = colorCode(event.getLevel());
        return code == null ? in : ESC + code + "m" + in + RESET;
    }

    private String colorCode(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> bright ? "1;91" : "1;31";
            case Level.WARN_INT -> bright ? "93" : "33";
            case Level.INFO_INT -> bright ? "94" : "34";
            case Level.DEBUG_INT -> "90";
            default -> null;
        };
    }
}
