package com.example.umarell.data;

import java.util.Locale;

/** What one value per sensor means: the newest point in the window, or the window mean. */
public enum ReadingSelector {
    LAST,
    MEAN;

    public static ReadingSelector parse(String s) {
        if (s == null || s.isBlank()) return LAST;
        return ReadingSelector.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
