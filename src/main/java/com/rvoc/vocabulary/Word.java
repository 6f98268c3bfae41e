package com.rvoc.vocabulary;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import java.io.Serializable;
import java.util.Objects;

@Entity
@Table(name = "words")
public class Word {

    @EmbeddedId
    private Key key;

    protected Word() {
    }

    public Word(String word, int wordTypeId, int languageId) {
        this.key = new Key(word, wordTypeId, languageId);
    }

    public Key getKey() {
        return key;
    }

    public String getWord() {
        return key.word;
    }

    @Embeddable
    public static class Key implements Serializable {

        @Column(name = "word", nullable = false)
        private String word;

        @Column(name = "word_type", nullable = false)
        private int wordTypeId;

        @Column(name = "language", nullable = false)
        private int languageId;

        protected Key() {
        }

        public Key(String word, int wordTypeId, int languageId) {
            this.word = word;
            this.wordTypeId = wordTypeId;
            this.languageId = languageId;
        }

        public String getWord() {
            return word;
        }

        public int getWordTypeId() {
            return wordTypeId;
        }

        public int getLanguageId() {
            return languageId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key other)) {
                return false;
            }
            return wordTypeId == other.wordTypeId && languageId == other.languageId && word.equals(other.word);
        }

        @Override
        public int hashCode() {
            return Objects.hash(word, wordTypeId, languageId);
        }
    }
}
