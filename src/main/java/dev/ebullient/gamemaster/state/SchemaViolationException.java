package dev.ebullient.gamemaster.state;

public class SchemaViolationException extends WorldStateException {

    private final String expected;
    private final String actual;

    public SchemaViolationException(String path, String expected, String actual) {
        super(path, "Schema violation at %s: expected %s, got %s".formatted(path, expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    protected SchemaViolationException(String path, String expected, String actual, String message) {
        super(path, message);
        this.expected = expected;
        this.actual = actual;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
