package com.github.wikiexport.parsing;

/**
 * The wiki's base path could not be determined from the seed page.
 */
public class DiscoveryException extends Exception {
    private static final long serialVersionUID = 4129043829011744215L;

    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
