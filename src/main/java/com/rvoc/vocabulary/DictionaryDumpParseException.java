package com.rvoc.vocabulary;

public class DictionaryDumpParseException extends RuntimeException {

    public DictionaryDumpParseException(String message) {
        super(message);
    }

    public DictionaryDumpParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
