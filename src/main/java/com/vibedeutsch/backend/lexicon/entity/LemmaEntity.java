package com.vibedeutsch.backend.lexicon.entity;

import com.vibedeutsch.backend.lexicon.nlp.TextNorm;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 詞條（lemma）。同拼字可以有多筆（同形異義），不對 lemma_text 做 unique。
 * enrichment_key 只有模型建立的詞條才有值，用來擋多台機器同時寫入同一個查詢。
 */
@Getter
@Setter
@Entity
@Table(name = "word_lemmas",
        indexes = {
                @Index(name = "idx_lemma_text", columnList = "lemma_text"),
                @Index(name = "idx_lemma_len_freq", columnList = "text_length, frequency_rank")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_lemma_enrichment_key", columnNames = "enrichment_key"))
public class LemmaEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "lemma_text", nullable = false, length = 128)
    private String text;

    @Column(name = "text_length", nullable = false)
    private Integer textLength;

    @Column(name = "pos", length = 32)
    private String pos;

    /** A1..C2 */
    @Column(name = "cefr", length = 8)
    private String cefr;

    /** 越大越常用 */
    @Column(name = "frequency_rank", nullable = false)
    private Integer frequencyRank = 0;

    @Lob
    @Column(name = "notes")
    private String notes;

    @Convert(converter = ProvenanceConverter.class)
    @Column(name = "source", nullable = false, length = 32)
    private Provenance source;

    @Column(name = "needs_review", nullable = false)
    private boolean needsReview;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "enrichment_key", length = 128)
    private String enrichmentKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @OneToMany(mappedBy = "lemma", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("senseIndex ASC")
    private List<SenseEntity> senses = new ArrayList<>();

    @OneToMany(mappedBy = "lemma", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<InflectedFormEntity> forms = new ArrayList<>();

    public SenseEntity addSense(SenseEntity s) {
        s.setLemma(this);
        s.setSenseIndex(senses.size());
        senses.add(s);
        return s;
    }

    public InflectedFormEntity addForm(InflectedFormEntity f) {
        f.setLemma(this);
        forms.add(f);
        return f;
    }

    @PrePersist
    @PreUpdate
    void syncLength() {
        this.textLength = TextNorm.codePointLength(text);
    }
}
