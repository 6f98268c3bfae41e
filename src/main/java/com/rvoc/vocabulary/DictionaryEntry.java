package com.rvoc.vocabulary;

/**
 * One word of a dictionary dump.
 *
 * @param word     the written form
 * @param wordType part of speech, e.g. {@code noun}
 * @param language English name of the language, e.g. {@code English}
 */
public record DictionaryEntry(String word, String wordType, String language) {
}
