package com.vibedeutsch.backend.lexicon.enrich;

import com.vibedeutsch.backend.lexicon.match.Suggestion;
import com.vibedeutsch.backend.lexicon.store.LexiconEntry;

import java.util.List;

/** Enrichment Gateway 的結果（records → 結構相等） */
public sealed interface EnrichmentOutcome
        permits EnrichmentOutcome.Resolved, EnrichmentOutcome.Suggestions,
                EnrichmentOutcome.Rejected, EnrichmentOutcome.Failed {

    /** 驗證通過並已落庫（或接到既有詞條） */
    record Resolved(LexiconEntry entry, boolean created) implements EnrichmentOutcome {}

    /** 模型說不是德文字；什麼都沒寫 */
    record Suggestions(String reason, List<Suggestion> suggestions) implements EnrichmentOutcome {
        public Suggestions {
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }
    }

    /** 模型改了輸入或拒答；什麼都沒寫 */
    record Rejected(String reason, List<Suggestion> suggestions) implements EnrichmentOutcome {
        public Rejected {
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }
    }

    /** 暫時性失敗（逾時、格式錯、網路），可重試 */
    record Failed(String reason, boolean retryable) implements EnrichmentOutcome {}
}
