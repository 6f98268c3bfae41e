package com.rvoc.vocabulary;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "languages")
public class Language {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "english_name", nullable = false, unique = true)
    private String englishName;

    protected Language() {
    }

    public Language(String englishName) {
        this.englishName = englishName;
    }

    public Integer getId() {
        return id;
    }

    public String getEnglishName() {
        return englishName;
    }
}
