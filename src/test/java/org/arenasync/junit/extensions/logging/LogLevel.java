package org.arenasync.junit.extensions.logging;

/**
 * Log levels the {@link LogWatchExtension} can be told about.
 */
public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
