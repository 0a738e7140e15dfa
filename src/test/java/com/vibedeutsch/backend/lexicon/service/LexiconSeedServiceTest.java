package com.vibedeutsch.backend.lexicon.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibedeutsch.backend.lexicon.repo.LemmaRepo;
import com.vibedeutsch.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ResourceLoader;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class LexiconSeedServiceTest extends BaseSpringTest {

    private static final String SEED = "classpath:seed/lexicon-seed.json";

    @Autowired LexiconSeedService seedService;
    @Autowired LemmaRepo lemmaRepo;
    @Autowired ResourceLoader resourceLoader;
    @Autowired ObjectMapper om;

    private LexiconSeedImporter importer;

    @BeforeEach
    void setUp() {
        lemmaRepo.deleteAll();
        importer = new LexiconSeedImporter(resourceLoader, om, seedService);
    }

    @Test
    void bundled_seed_imports_once_and_is_idempotent() {
        LexiconSeedService.ImportStats first = importer.importFrom(SEED);
        LexiconSeedService.ImportStats second = importer.importFrom(SEED);

        assertThat(first.imported()).isEqualTo(7);
        assertThat(first.skipped()).isZero();
        assertThat(second.imported()).isZero();
        assertThat(second.skipped()).isEqualTo(7);
        assertThat(lemmaRepo.count()).isEqualTo(7);
    }

    @Test
    void homographs_are_seeded_as_separate_lemmas() {
        importer.importFrom(SEED);

        assertThat(lemmaRepo.findByExactText("Bank")).hasSize(2);
    }

    @Test
    void invalid_rows_are_skipped() {
        LexiconSeedFile file = new LexiconSeedFile(List.of(
                new LexiconSeedFile.SeedLemma(" ", "noun", null, null, null, null, null),
                new LexiconSeedFile.SeedLemma("Tee", null, null, null, null, null, null),
                new LexiconSeedFile.SeedLemma("Tee", "noun", "A1", 500, null,
                        List.of(new LexiconSeedFile.SeedSense("noun", "masc", Map.of("en", List.of("tea")), null)),
                        null)
        ));

        LexiconSeedService.ImportStats stats = seedService.importAll(file);

        assertThat(stats.imported()).isEqualTo(1);
        assertThat(stats.skipped()).isEqualTo(2);
    }

    @Test
    void missing_seed_file_is_a_no_op() {
        LexiconSeedService.ImportStats stats = importer.importFrom("classpath:seed/does-not-exist.json");

        assertThat(stats.imported()).isZero();
    }
}
