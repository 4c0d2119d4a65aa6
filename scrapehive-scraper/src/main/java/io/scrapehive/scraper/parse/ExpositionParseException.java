package io.scrapehive.scraper.parse;

public class ExpositionParseException extends Exception {

    public ExpositionParseException(String message) {
        super(message);
    }

    public ExpositionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
