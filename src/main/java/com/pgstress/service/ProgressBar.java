package com.pgstress.service;

/**
 * Text progress bar for log lines, e.g. {@code [=====     ]  50% (5/10)}.
 */
public final class ProgressBar {

    static final int WIDTH = 50;

    private ProgressBar() {
    }

    public static String render(long current, long total) {
        int percentage = total > 0 ? (int) (current * 100 / total) : 0;
        int filled = total > 0 ? (int) Math.min(WIDTH, current * WIDTH / total) : 0;
        return "[" + "=".repeat(filled) + " ".repeat(WIDTH - filled) + "] "
            + String.format("%3d%% (%d/%d)", percentage, current, total);
    }
}
