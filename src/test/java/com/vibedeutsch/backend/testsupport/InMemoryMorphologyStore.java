package com.vibedeutsch.backend.testsupport;

import com.vibedeutsch.backend.lexicon.nlp.TextNorm;
import com.vibedeutsch.backend.lexicon.store.InflectedHit;
import com.vibedeutsch.backend.lexicon.store.LemmaSummary;
import com.vibedeutsch.backend.lexicon.store.LexiconEntry;
import com.vibedeutsch.backend.lexicon.store.MorphologyStore;
import com.vibedeutsch.backend.lexicon.store.SenseKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** 測試用詞庫：語意跟 JpaMorphologyStore 一致（大小寫敏感、長度窗排序） */
public class InMemoryMorphologyStore implements MorphologyStore {

    private record Form(long lemmaId, Long senseId, String form, String key, String value) {}
    private record Gloss(long lemmaId, long senseId, String lang, String text) {}

    private final Map<Long, List<LemmaSummary>> lemmas = new LinkedHashMap<>();
    private final List<Form> forms = new ArrayList<>();
    private final List<Gloss> glosses = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private long nextSenseId = 100;

    /** 新增 lemma（一個義項），回傳 senseId */
    public long addLemma(long lemmaId, String text, String pos, String gender, int frequencyRank) {
        long senseId = nextSenseId++;
        lemmas.computeIfAbsent(lemmaId, k -> new ArrayList<>())
                .add(new LemmaSummary(new SenseKey(lemmaId, senseId), text, pos, gender, frequencyRank));
        return senseId;
    }

    public void addForm(long lemmaId, String form, String key, String value) {
        forms.add(new Form(lemmaId, null, form, key, value));
    }

    public void addTranslation(long lemmaId, long senseId, String lang, String text) {
        glosses.add(new Gloss(lemmaId, senseId, lang, text));
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public List<LemmaSummary> findLemmaByExactText(String text) {
        calls.incrementAndGet();
        List<LemmaSummary> out = new ArrayList<>();
        for (List<LemmaSummary> senses : lemmas.values()) {
            for (LemmaSummary s : senses) {
                if (s.text().equals(text)) out.add(s);
            }
        }
        return out;
    }

    @Override
    public List<InflectedHit> findLemmaByInflectedForm(String text) {
        calls.incrementAndGet();
        List<InflectedHit> out = new ArrayList<>();
        for (Form f : forms) {
            if (!f.form().equals(text)) continue;
            for (LemmaSummary s : lemmas.getOrDefault(f.lemmaId(), List.of())) {
                out.add(new InflectedHit(s, f.form(), f.key(), f.value()));
            }
        }
        return out;
    }

    @Override
    public List<LemmaSummary> candidatesByLengthWindow(String text, int window, int limit) {
        calls.incrementAndGet();
        int len = TextNorm.codePointLength(text);
        List<Map.Entry<Long, List<LemmaSummary>>> rows = new ArrayList<>();
        for (Map.Entry<Long, List<LemmaSummary>> e : lemmas.entrySet()) {
            int l = TextNorm.codePointLength(e.getValue().get(0).text());
            if (Math.abs(l - len) <= window) rows.add(e);
        }
        rows.sort(Comparator
                .comparingInt((Map.Entry<Long, List<LemmaSummary>> e) ->
                        Math.abs(TextNorm.codePointLength(e.getValue().get(0).text()) - len))
                .thenComparing(Comparator.comparingInt((Map.Entry<Long, List<LemmaSummary>> e) ->
                        e.getValue().get(0).frequencyRank()).reversed())
                .thenComparingLong(Map.Entry::getKey));

        List<LemmaSummary> out = new ArrayList<>();
        for (int i = 0; i < rows.size() && i < limit; i++) {
            out.addAll(rows.get(i).getValue());
        }
        return out;
    }

    @Override
    public List<LemmaSummary> findSensesByTranslation(String text) {
        calls.incrementAndGet();
        List<LemmaSummary> out = new ArrayList<>();
        for (Gloss g : glosses) {
            if (!g.text().equals(text)) continue;
            for (LemmaSummary s : lemmas.getOrDefault(g.lemmaId(), List.of())) {
                if (s.senseId() == g.senseId()) out.add(s);
            }
        }
        return out;
    }

    @Override
    public Optional<LexiconEntry> loadEntry(SenseKey key) {
        for (LemmaSummary s : lemmas.getOrDefault(key.lemmaId(), List.of())) {
            if (s.key().equals(key)) {
                List<LexiconEntry.Form> fs = forms.stream()
                        .filter(f -> f.lemmaId() == key.lemmaId())
                        .map(f -> new LexiconEntry.Form(f.form(), f.key(), f.value()))
                        .toList();
                return Optional.of(new LexiconEntry(s.lemmaId(), s.senseId(), s.text(), s.pos(), s.gender(),
                        null, s.frequencyRank(), "seed", false, 1.0, Map.of(), fs, List.of()));
            }
        }
        return Optional.empty();
    }
}
