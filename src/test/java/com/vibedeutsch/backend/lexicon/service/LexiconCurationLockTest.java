package com.vibedeutsch.backend.lexicon.service;

import com.vibedeutsch.backend.lexicon.entity.LemmaEntity;
import com.vibedeutsch.backend.lexicon.entity.Provenance;
import com.vibedeutsch.backend.lexicon.entity.SenseEntity;
import com.vibedeutsch.backend.lexicon.repo.LemmaRepo;
import com.vibedeutsch.backend.lexicon.repo.SenseRepo;
import com.vibedeutsch.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.vibedeutsch.backend.testsupport.LexiconFixtures.lemma;
import static com.vibedeutsch.backend.testsupport.LexiconFixtures.sense;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class LexiconCurationLockTest extends BaseSpringTest {

    @Autowired LexiconCurationService curation;
    @Autowired LemmaRepo lemmaRepo;
    @Autowired SenseRepo senseRepo;

    private Long senseId;

    @BeforeEach
    void setUp() {
        lemmaRepo.deleteAll();
        LemmaEntity l = lemma("Kaffee", "noun", 600);
        SenseEntity s = sense(l, null, Provenance.EXTERNAL_MODEL);
        s.setNeedsReview(true);
        lemmaRepo.save(l);
        senseId = l.getSenses().get(0).getId();
    }

    @Test
    void concurrent_corrections_of_same_sense_let_only_one_through() throws Exception {
        int n = 4;
        ExecutorService pool = Executors.newFixedThreadPool(n);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < n; i++) {
                String gender = i % 2 == 0 ? "masc" : "neut";
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        curation.correctSense(senseId, null, gender);
                        return "OK";
                    } catch (IllegalArgumentException e) {
                        return e.getMessage();
                    }
                }));
            }
            start.countDown();

            List<String> outcomes = new ArrayList<>();
            for (Future<String> f : results) outcomes.add(f.get(10, TimeUnit.SECONDS));

            assertThat(outcomes).filteredOn("OK"::equals).hasSize(1);
            assertThat(outcomes).filteredOn("SENSE_LOCKED"::equals).hasSize(n - 1);
        } finally {
            pool.shutdownNow();
        }

        SenseEntity after = senseRepo.findById(senseId).orElseThrow();
        assertThat(after.isManual()).isTrue();
    }
}
