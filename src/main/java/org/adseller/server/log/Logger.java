package org.adseller.server.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.message.FormattedMessage;
import org.apache.logging.log4j.spi.ExtendedLogger;

/**
 * Thin facade over log4j2 that accepts {@link java.text.MessageFormat}-style placeholders ({0}, {1}, ...).
 */
public class Logger {

    private static final String FQCN = Logger.class.getCanonicalName();

    private final ExtendedLogger delegate;

    Logger(ExtendedLogger delegate) {
        this.delegate = delegate;
    }

    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }

    public void error(String message, Throwable t) {
        delegate.logIfEnabled(FQCN, Level.ERROR, null, message, t);
    }

    public void warn(String message, Object... params) {
        log(Level.WARN, message, params);
    }

    public void info(String message, Object... params) {
        log(Level.INFO, message, params);
    }

    public void debug(String message, Object... params) {
        log(Level.DEBUG, message, params);
    }

    private void log(Level level, String message, Object... params) {
        if (delegate.isEnabled(level)) {
            delegate.logMessage(FQCN, level, null, new FormattedMessage(message, params), null);
        }
    }
}
