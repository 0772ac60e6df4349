package com.descant;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A user-readable diagnostic.
 *
 * @param where    position the message refers to
 * @param msg      message text
 * @param internal true for internal compiler errors rather than user errors
 * @param fallback only report this message if nothing better was found
 */
public record ErrorEntry(SourcePosition where, String msg, boolean internal, boolean fallback) {

    public ErrorEntry(SourcePosition where, String msg) {
        this(where, msg, false, false);
    }

    /**
     * Appends {@code entry} to {@code errors}, honoring the fallback rule: a
     * fallback message is dropped when an error at an equal or later position
     * has already been recorded.
     *
     * @return true if the entry was added
     */
    public static boolean report(List<ErrorEntry> errors, ErrorEntry entry) {
        if (entry.fallback()) {
            for (ErrorEntry existing : errors) {
                if (existing.where().compareTo(entry.where()) >= 0) {
                    return false;
                }
            }
        }
        errors.add(entry);
        return true;
    }

    /**
     * Stable sort by position, so independent errors come out in source
     * order no matter which stage raised them.
     */
    public static List<ErrorEntry> sorted(List<ErrorEntry> errors) {
        List<ErrorEntry> copy = new ArrayList<>(errors);
        copy.sort(Comparator.comparing(ErrorEntry::where));
        return copy;
    }

    public String format(String file) {
        return file + where + ": " + (internal ? "internal compiler error: " : "error: ") + msg;
    }
}
