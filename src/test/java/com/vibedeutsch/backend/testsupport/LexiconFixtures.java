package com.vibedeutsch.backend.testsupport;

import com.vibedeutsch.backend.lexicon.entity.InflectedFormEntity;
import com.vibedeutsch.backend.lexicon.entity.LemmaEntity;
import com.vibedeutsch.backend.lexicon.entity.Provenance;
import com.vibedeutsch.backend.lexicon.entity.SenseEntity;
import com.vibedeutsch.backend.lexicon.entity.TranslationEntity;

/** 直接組 entity，給 JPA 測試用 */
public final class LexiconFixtures {
    private LexiconFixtures() {}

    public static LemmaEntity lemma(String text, String pos, int frequencyRank) {
        LemmaEntity l = new LemmaEntity();
        l.setText(text);
        l.setPos(pos);
        l.setFrequencyRank(frequencyRank);
        l.setSource(Provenance.SEED);
        l.setConfidence(1.0);
        return l;
    }

    public static SenseEntity sense(LemmaEntity l, String gender, Provenance source) {
        SenseEntity s = new SenseEntity();
        s.setPos(l.getPos());
        s.setGender(gender);
        s.setSource(source);
        s.setConfidence(1.0);
        return l.addSense(s);
    }

    public static InflectedFormEntity form(LemmaEntity l, String form, String key, String value) {
        InflectedFormEntity f = new InflectedFormEntity();
        f.setForm(form);
        f.setFeatureKey(key);
        f.setFeatureValue(value);
        f.setSource(Provenance.SEED);
        return l.addForm(f);
    }

    public static TranslationEntity translation(SenseEntity s, String lang, String text) {
        TranslationEntity t = new TranslationEntity();
        t.setLangCode(lang);
        t.setText(text);
        t.setSource(Provenance.SEED);
        t.setConfidence(1.0);
        return s.addTranslation(t);
    }
}
