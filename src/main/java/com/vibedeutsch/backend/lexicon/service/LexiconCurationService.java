package com.vibedeutsch.backend.lexicon.service;

import com.vibedeutsch.backend.lexicon.entity.LemmaEntity;
import com.vibedeutsch.backend.lexicon.entity.Provenance;
import com.vibedeutsch.backend.lexicon.entity.SenseEntity;
import com.vibedeutsch.backend.lexicon.repo.SenseRepo;
import com.vibedeutsch.backend.lexicon.store.LexiconEntries;
import com.vibedeutsch.backend.lexicon.store.LexiconEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Set;

/**
 * 人工修正義項的核心文法屬性：只允許一次，之後標成 manual，模型補全不再覆寫。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LexiconCurationService {

    private static final Set<String> GENDERS = Set.of("masc", "fem", "neut");

    private final SenseRepo senseRepo;

    @Transactional
    public LexiconEntry correctSense(Long senseId, String pos, String gender) {
        SenseEntity s = senseRepo.findByIdForUpdate(senseId)
                .orElseThrow(() -> new IllegalArgumentException("SENSE_NOT_FOUND"));
        if (s.isManual()) throw new IllegalArgumentException("SENSE_LOCKED");

        String p = pos == null ? null : pos.trim().toLowerCase(Locale.ROOT);
        String g = gender == null ? null : gender.trim().toLowerCase(Locale.ROOT);
        if ((p == null || p.isEmpty()) && (g == null || g.isEmpty())) throw new IllegalArgumentException("CORRECTION_EMPTY");
        if (g != null && !g.isEmpty() && !GENDERS.contains(g)) throw new IllegalArgumentException("GENDER_INVALID");

        if (p != null && !p.isEmpty()) s.setPos(p);
        if (g != null && !g.isEmpty()) s.setGender(g);
        s.setSource(Provenance.MANUAL);
        s.setNeedsReview(false);
        s.setConfidence(1.0);

        LemmaEntity l = s.getLemma();
        if (l.isNeedsReview() && l.getSenses().stream().allMatch(x -> x == s || !x.isNeedsReview())) {
            l.setNeedsReview(false);
        }

        log.info("lexicon_sense_corrected senseId={} lemmaId={} pos={} gender={}", s.getId(), l.getId(), s.getPos(), s.getGender());
        return LexiconEntries.entry(l, s);
    }
}
