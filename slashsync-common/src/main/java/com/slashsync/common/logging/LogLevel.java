package com.slashsync.common.logging;

/**
 * Levels {@link SubsystemLogger} writes at.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
