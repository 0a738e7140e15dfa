package com.vibedeutsch.backend.lexicon.entity;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = false)
public class ProvenanceConverter implements AttributeConverter<Provenance, String> {
    @Override public String convertToDatabaseColumn(Provenance p) { return p == null ? null : p.dbValue(); }
    @Override public Provenance convertToEntityAttribute(String s) { return Provenance.fromDbValue(s); }
}
