package com.furniture.queryparser.service;

public class LexiconLoadException extends RuntimeException {
    /**
     * Creates an exception describing an invalid lexicon definition.
     */
    public LexiconLoadException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public LexiconLoadException(String m, Throwable c) { super(m, c); }
}
