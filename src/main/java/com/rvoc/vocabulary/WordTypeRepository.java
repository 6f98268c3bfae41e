package com.rvoc.vocabulary;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WordTypeRepository extends JpaRepository<WordType, Integer> {

    Optional<WordType> findByEnglishName(String englishName);
}
