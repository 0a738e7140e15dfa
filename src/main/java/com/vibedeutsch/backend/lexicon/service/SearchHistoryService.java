package com.vibedeutsch.backend.lexicon.service;

import com.vibedeutsch.backend.lexicon.entity.SearchHistoryEntity;
import com.vibedeutsch.backend.lexicon.nlp.NormalizedQuery;
import com.vibedeutsch.backend.lexicon.repo.SearchHistoryRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** 每次 resolve 寫一筆；寫失敗只記 log，不影響查詢結果 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchHistoryService {

    private static final int MAX_TEXT = 256;

    private final SearchHistoryRepo repo;

    public void record(NormalizedQuery q, ResolutionResult result) {
        try {
            SearchHistoryEntity h = new SearchHistoryEntity();
            h.setQueryText(clip(q.original()));
            h.setNormalizedText(clip(q.text()));
            h.setDetectedLanguage(q.detectedLanguage() == null ? null : q.detectedLanguage().tag());
            h.setOutcome(result.status());
            if (result instanceof ResolutionResult.Found f) h.setLemmaId(f.entry().lemmaId());
            repo.save(h);
        } catch (RuntimeException e) {
            // 連線、交易層的失敗也只記 log
            log.warn("search_history_write_failed query={} err={}", clip(q.text()), e.toString());
        }
    }

    private static String clip(String s) {
        if (s == null) return "";
        return s.length() > MAX_TEXT ? s.substring(0, MAX_TEXT) : s;
    }
}
