package com.rvoc.vocabulary;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WordRepository extends JpaRepository<Word, Word.Key> {

    @Query("""
            SELECT w FROM Word w, Language l
            WHERE w.key.languageId = l.id
              AND l.englishName = :language
              AND w.key.word = :word
            """)
    List<Word> findByWordAndLanguage(@Param("word") String word, @Param("language") String language);
}
