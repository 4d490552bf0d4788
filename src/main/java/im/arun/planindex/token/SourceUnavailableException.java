package im.arun.planindex.token;

/**
 * A page source (PDF or raster image) is missing or cannot be read.
 */
public class SourceUnavailableException extends Exception {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
