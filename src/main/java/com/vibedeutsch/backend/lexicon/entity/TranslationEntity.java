package com.vibedeutsch.backend.lexicon.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/** 譯文只新增不覆寫（append-only），保留來源軌跡 */
@Getter
@Setter
@Entity
@Table(name = "translations",
        indexes = {
                @Index(name = "idx_tr_sense_lang", columnList = "sense_id, lang_code"),
                @Index(name = "idx_tr_text", columnList = "text")
        })
public class TranslationEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sense_id", nullable = false, updatable = false)
    private SenseEntity sense;

    @Column(name = "lang_code", nullable = false, length = 8, updatable = false)
    private String langCode;

    @Column(name = "text", nullable = false, length = 200, updatable = false)
    private String text;

    @Convert(converter = ProvenanceConverter.class)
    @Column(name = "source", nullable = false, length = 32, updatable = false)
    private Provenance source;

    @Column(name = "confidence", updatable = false)
    private Double confidence;

    @Column(name = "needs_review", nullable = false)
    private boolean needsReview;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();
}
