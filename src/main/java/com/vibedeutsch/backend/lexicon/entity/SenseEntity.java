package com.vibedeutsch.backend.lexicon.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** 詞條的一個義項（詞性 + 性別 + 譯文）。不同義項永不合併。 */
@Getter
@Setter
@Entity
@Table(name = "word_senses",
        indexes = @Index(name = "idx_sense_lemma", columnList = "lemma_id"))
public class SenseEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lemma_id", nullable = false)
    private LemmaEntity lemma;

    @Column(name = "sense_index", nullable = false)
    private Integer senseIndex = 0;

    @Column(name = "pos", nullable = false, length = 32)
    private String pos;

    /** masc / fem / neut（名詞才有） */
    @Column(name = "gender", length = 8)
    private String gender;

    @Convert(converter = ProvenanceConverter.class)
    @Column(name = "source", nullable = false, length = 32)
    private Provenance source;

    @Column(name = "needs_review", nullable = false)
    private boolean needsReview;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @OneToMany(mappedBy = "sense", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<TranslationEntity> translations = new ArrayList<>();

    @OneToMany(mappedBy = "sense", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<ExampleEntity> examples = new ArrayList<>();

    public boolean isManual() {
        return source == Provenance.MANUAL;
    }

    public TranslationEntity addTranslation(TranslationEntity t) {
        t.setSense(this);
        translations.add(t);
        return t;
    }

    public ExampleEntity addExample(ExampleEntity e) {
        e.setSense(this);
        examples.add(e);
        return e;
    }
}
