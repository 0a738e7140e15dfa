package com.vibedeutsch.backend.lexicon.repo;

import com.vibedeutsch.backend.lexicon.entity.LemmaEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LemmaRepo extends JpaRepository<LemmaEntity, Long> {

    // 大小寫敏感：不做 lower()，由呼叫端把每個變體都查一次
    @Query("""
        select l from LemmaEntity l
        where l.text = :text
        order by l.id asc
    """)
    List<LemmaEntity> findByExactText(@Param("text") String text);

    Optional<LemmaEntity> findByEnrichmentKey(String enrichmentKey);

    @Query("""
        select l from LemmaEntity l
        where l.textLength between :minLen and :maxLen
        order by abs(l.textLength - :len) asc, l.frequencyRank desc, l.id asc
    """)
    List<LemmaEntity> findLengthWindow(@Param("len") int len,
                                       @Param("minLen") int minLen,
                                       @Param("maxLen") int maxLen,
                                       Pageable page);
}
