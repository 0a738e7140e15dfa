package com.vibedeutsch.backend.lexicon.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * 變化形（gehe → gehen）。
 * feature_key / feature_value 例：tense / praesens_ich、number / plural、gender / masc。
 */
@Getter
@Setter
@Entity
@Table(name = "word_forms",
        indexes = {
                @Index(name = "idx_form_form", columnList = "form"),
                @Index(name = "idx_form_lemma", columnList = "lemma_id")
        })
public class InflectedFormEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lemma_id", nullable = false)
    private LemmaEntity lemma;

    /** null 代表屬於 lemma 的所有義項 */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sense_id")
    private SenseEntity sense;

    @Column(name = "form", nullable = false, length = 128)
    private String form;

    @Column(name = "feature_key", nullable = false, length = 32)
    private String featureKey;

    @Column(name = "feature_value", nullable = false, length = 64)
    private String featureValue;

    @Convert(converter = ProvenanceConverter.class)
    @Column(name = "source", nullable = false, length = 32)
    private Provenance source;
}
