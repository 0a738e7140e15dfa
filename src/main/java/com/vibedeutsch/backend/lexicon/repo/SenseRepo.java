package com.vibedeutsch.backend.lexicon.repo;

import com.vibedeutsch.backend.lexicon.entity.SenseEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface SenseRepo extends JpaRepository<SenseEntity, Long> {

    // 人工修正用：同一義項的並行 PATCH 依序執行
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from SenseEntity s where s.id = :id")
    Optional<SenseEntity> findByIdForUpdate(@Param("id") Long id);

    @Query("""
        select s from SenseEntity s
        join fetch s.lemma l
        where l.id = :lemmaId
        order by s.senseIndex asc, s.id asc
    """)
    List<SenseEntity> findByLemmaId(@Param("lemmaId") Long lemmaId);

    // 反查：譯文文字完全相同（大小寫敏感）
    @Query("""
        select distinct s from TranslationEntity t
        join t.sense s
        join fetch s.lemma l
        where t.text = :text
        order by s.id asc
    """)
    List<SenseEntity> findByTranslationText(@Param("text") String text);

    @Query("""
        select s from SenseEntity s
        join fetch s.lemma l
        where l.text = :lemmaText and s.pos = :pos
        order by s.id asc
    """)
    List<SenseEntity> findByLemmaTextAndPos(@Param("lemmaText") String lemmaText, @Param("pos") String pos);
}
