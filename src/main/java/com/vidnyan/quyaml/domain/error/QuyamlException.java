package com.vidnyan.quyaml.domain.error;

/**
 * The single failure type of the compiler.
 * Carries the error kind and the document path of the offending field,
 * e.g. {@code ops[2].if.elif[0].cond}. Terminal for the parse attempt.
 */
public class QuyamlException extends RuntimeException {

    private final ErrorKind kind;
    private final String path;
    private final String detail;

    public QuyamlException(ErrorKind kind, String path, String detail) {
        this(kind, path, detail, null);
    }

    public QuyamlException(ErrorKind kind, String path, String detail, Throwable cause) {
        super(format(kind, path, detail), cause);
        this.kind = kind;
        this.path = path;
        this.detail = detail;
    }

    public static QuyamlException of(ErrorKind kind, String detail) {
        return new QuyamlException(kind, null, detail);
    }

    public static QuyamlException at(ErrorKind kind, String path, String detail) {
        return new QuyamlException(kind, path, detail);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Document path of the offending field, or null when not tied to one.
     */
    public String path() {
        return path;
    }

    public String detail() {
        return detail;
    }

    /**
     * Re-anchor this error under an enclosing path. The nested path, if any,
     * is appended so the result reads outer-to-inner.
     */
    public QuyamlException under(String outerPath) {
        if (outerPath == null || outerPath.isEmpty()) {
            return this;
        }
        String combined;
        if (path == null || path.isEmpty()) {
            combined = outerPath;
        } else if (path.startsWith("[")) {
            combined = outerPath + path;
        } else {
            combined = outerPath + "." + path;
        }
        return new QuyamlException(kind, combined, detail, getCause());
    }

    private static String format(ErrorKind kind, String path, String detail) {
        if (path == null || path.isEmpty()) {
            return kind + ": " + detail;
        }
        return kind + " at " + path + ": " + detail;
    }
}
