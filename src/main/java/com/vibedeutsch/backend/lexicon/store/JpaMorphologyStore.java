package com.vibedeutsch.backend.lexicon.store;

import com.vibedeutsch.backend.lexicon.entity.InflectedFormEntity;
import com.vibedeutsch.backend.lexicon.entity.LemmaEntity;
import com.vibedeutsch.backend.lexicon.entity.SenseEntity;
import com.vibedeutsch.backend.lexicon.nlp.TextNorm;
import com.vibedeutsch.backend.lexicon.repo.InflectedFormRepo;
import com.vibedeutsch.backend.lexicon.repo.LemmaRepo;
import com.vibedeutsch.backend.lexicon.repo.SenseRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaMorphologyStore implements MorphologyStore {

    private final LemmaRepo lemmaRepo;
    private final SenseRepo senseRepo;
    private final InflectedFormRepo formRepo;

    @Override
    public List<LemmaSummary> findLemmaByExactText(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<LemmaSummary> out = new ArrayList<>();
        for (LemmaEntity l : lemmaRepo.findByExactText(text)) {
            out.addAll(LexiconEntries.summaries(l));
        }
        return out;
    }

    @Override
    public List<InflectedHit> findLemmaByInflectedForm(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<InflectedHit> out = new ArrayList<>();
        for (InflectedFormEntity f : formRepo.findByExactForm(text)) {
            LemmaEntity l = f.getLemma();
            if (f.getSense() != null) {
                out.add(new InflectedHit(LexiconEntries.summary(l, f.getSense()),
                        f.getForm(), f.getFeatureKey(), f.getFeatureValue()));
                continue;
            }
            // 未綁義項：展開到該 lemma 的所有義項
            for (LemmaSummary s : LexiconEntries.summaries(l)) {
                out.add(new InflectedHit(s, f.getForm(), f.getFeatureKey(), f.getFeatureValue()));
            }
        }
        return out;
    }

    @Override
    public List<LemmaSummary> candidatesByLengthWindow(String text, int window, int limit) {
        if (text == null || text.isEmpty() || limit <= 0) return List.of();
        int len = TextNorm.codePointLength(text);
        int w = Math.max(0, window);
        List<LemmaEntity> rows = lemmaRepo.findLengthWindow(len, Math.max(1, len - w), len + w, PageRequest.of(0, limit));
        List<LemmaSummary> out = new ArrayList<>();
        for (LemmaEntity l : rows) {
            out.addAll(LexiconEntries.summaries(l));
        }
        return out;
    }

    @Override
    public List<LemmaSummary> findSensesByTranslation(String text) {
        if (text == null || text.isEmpty()) return List.of();
        List<LemmaSummary> out = new ArrayList<>();
        for (SenseEntity s : senseRepo.findByTranslationText(text)) {
            out.add(LexiconEntries.summary(s.getLemma(), s));
        }
        return out;
    }

    @Override
    public Optional<LexiconEntry> loadEntry(SenseKey key) {
        if (key == null) return Optional.empty();
        return lemmaRepo.findById(key.lemmaId()).map(l -> {
            SenseEntity sense = null;
            if (key.senseId() != null) {
                sense = l.getSenses().stream()
                        .filter(s -> Objects.equals(s.getId(), key.senseId()))
                        .findFirst()
                        .orElse(null);
            }
            return LexiconEntries.entry(l, sense);
        });
    }
}
