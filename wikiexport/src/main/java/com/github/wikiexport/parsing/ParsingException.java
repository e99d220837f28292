package com.github.wikiexport.parsing;

/**
 * Signals misuse of the tokenizer or an extractor. Broken markup never raises
 * this exception; it is logged and recovered from instead.
 */
public class ParsingException extends RuntimeException {
    private static final long serialVersionUID = -8845784388792588721L;

    public ParsingException(String message) {
        super(message);
    }

    public ParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
