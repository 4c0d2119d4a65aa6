package io.scrapehive.scraper.target;

/**
 * The target list for a cycle could not be built, e.g. a service URL is not a valid URI.
 */
public class TargetResolutionException extends Exception {

    public TargetResolutionException(String message) {
        super(message);
    }

    public TargetResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
