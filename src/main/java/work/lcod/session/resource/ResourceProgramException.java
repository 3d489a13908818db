package work.lcod.session.resource;

/**
 * Raised when a requirement expression cannot be compiled.
 */
public final class ResourceProgramException extends RuntimeException {
    private final String text;

    public ResourceProgramException(String text, String message) {
        super(message + " in requirement expression '" + text + "'");
        this.text = text;
    }

    public String text() {
        return text;
    }
}
