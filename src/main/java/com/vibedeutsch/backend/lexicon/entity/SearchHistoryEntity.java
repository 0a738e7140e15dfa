package com.vibedeutsch.backend.lexicon.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/** 查詢紀錄：寫一次，不更新 */
@Getter
@Setter
@Entity
@Table(name = "search_history",
        indexes = @Index(name = "idx_history_created", columnList = "created_at"))
public class SearchHistoryEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "query_text", nullable = false, length = 256, updatable = false)
    private String queryText;

    @Column(name = "normalized_text", nullable = false, length = 256, updatable = false)
    private String normalizedText;

    @Column(name = "detected_language", length = 8, updatable = false)
    private String detectedLanguage;

    @Column(name = "outcome", nullable = false, length = 32, updatable = false)
    private String outcome;

    @Column(name = "lemma_id", updatable = false)
    private Long lemmaId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();
}
