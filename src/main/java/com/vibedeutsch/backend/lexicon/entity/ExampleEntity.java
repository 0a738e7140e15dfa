package com.vibedeutsch.backend.lexicon.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "examples",
        indexes = @Index(name = "idx_example_sense", columnList = "sense_id"))
public class ExampleEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sense_id", nullable = false, updatable = false)
    private SenseEntity sense;

    @Column(name = "de_text", nullable = false, length = 500, updatable = false)
    private String deText;

    @Column(name = "en_text", length = 500, updatable = false)
    private String enText;

    @Column(name = "zh_text", length = 500, updatable = false)
    private String zhText;

    @Column(name = "cefr_level", length = 8, updatable = false)
    private String level = "A1";

    @Convert(converter = ProvenanceConverter.class)
    @Column(name = "source", nullable = false, length = 32, updatable = false)
    private Provenance source;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();
}
