package com.github.wikiexport.main;

import java.io.IOException;
import java.net.URI;

/**
 * The server answered with a non-successful HTTP status.
 */
public class TransportException extends IOException {
    private static final long serialVersionUID = 2286193405522618791L;

    private final int statusCode;
    private final URI uri;

    public TransportException(int statusCode, URI uri) {
        super(String.format("HTTP %d for %s", statusCode, uri));
        this.statusCode = statusCode;
        this.uri = uri;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public URI getUri() {
        return uri;
    }
}
