package org.meshbus.junit.extensions.logging;

/**
 * Log levels understood by {@link LogWatchExtension}.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
