package com.podshift.dependency.model;

import lombok.Value;

import java.util.Comparator;

/**
 * A non-fatal issue recorded during resolution. Nothing is fixed silently without one.
 */
@Value
public class Diagnostic implements Comparable<Diagnostic> {

    public enum Severity {
        INFO,
        WARNING
    }

    public enum Code {
        MALFORMED_INPUT,            // One node could not be read by one extractor; node skipped there
        DANGLING_REFERENCE,         // Edge pointed at an unknown container; edge dropped
        CYCLE_ENUMERATION_TRUNCATED,
        EXTRACTOR_DISABLED
    }

    private static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::getCode)
            .thenComparing(Diagnostic::getSource)
            .thenComparing(Diagnostic::getSubject)
            .thenComparing(Diagnostic::getMessage);

    Severity severity;
    Code code;
    String source;                  // Stage or extractor that recorded it
    String subject;                 // Container id, edge key, ...
    String message;

    public static Diagnostic malformed(String source, String subject, String message) {
        return new Diagnostic(Severity.WARNING, Code.MALFORMED_INPUT, source, nonNull(subject), message);
    }

    public static Diagnostic dangling(String source, String subject, String message) {
        return new Diagnostic(Severity.WARNING, Code.DANGLING_REFERENCE, source, nonNull(subject), message);
    }

    public static Diagnostic truncated(String source, String message) {
        return new Diagnostic(Severity.WARNING, Code.CYCLE_ENUMERATION_TRUNCATED, source, "", message);
    }

    public static Diagnostic disabled(String source, String message) {
        return new Diagnostic(Severity.INFO, Code.EXTRACTOR_DISABLED, source, "", message);
    }

    private static String nonNull(String value) {
        return value == null ? "<unknown>" : value;
    }

    @Override
    public int compareTo(Diagnostic other) {
        return ORDER.compare(this, other);
    }
}
