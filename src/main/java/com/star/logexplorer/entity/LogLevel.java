package com.star.logexplorer.entity;

import java.util.Locale;

/**
 * Closed set of normalized severities. Every raw level found in a log
 * line is folded into one of these.
 */
public enum LogLevel {
    ERR,
    WRN,
    INF;

    /**
     * Maps a raw level token onto the closed set using case-insensitive
     * substring rules. Unknown or missing values become {@link #INF}.
     */
    public static LogLevel normalize(String rawLevel) {
        if (rawLevel == null) {
            return INF;
        }

        String level = rawLevel.trim().toUpperCase(Locale.ROOT);

        if (level.contains("ERROR") || level.contains("FATAL") || level.contains("SEVERE")
                || level.equals("ERR")) {
            return ERR;
        }
        if (level.contains("WARN") || level.equals("WRN")) {
            return WRN;
        }
        // INFO, INFORMATION, DEBUG, TRACE, VERBOSE and anything unknown
        return INF;
    }

    /**
     * Strict lookup for boundary input; {@code null} when the value is not
     * one of the three exact tokens.
     */
    public static LogLevel fromToken(String token) {
        if (token == null) {
            return null;
        }
        for (LogLevel level : values()) {
            if (level.name().equalsIgnoreCase(token.trim())) {
                return level;
            }
        }
        return null;
    }
}
