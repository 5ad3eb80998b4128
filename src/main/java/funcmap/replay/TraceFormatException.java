package funcmap.replay;

/**
 * A line of an event trace could not be understood.
 */
public class TraceFormatException extends Exception {
    private final int lineNumber;

    public TraceFormatException(int lineNumber, String message) {
        super(String.format("line %d: %s", lineNumber, message));
        this.lineNumber = lineNumber;
    }

    public TraceFormatException(int lineNumber, String message, Throwable cause) {
        super(String.format("line %d: %s", lineNumber, message), cause);
        this.lineNumber = lineNumber;
    }

    /** 1-based line number of the offending line */
    public int getLineNumber() {
        return lineNumber;
    }
}
