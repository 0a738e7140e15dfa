package com.vibedeutsch.backend.lexicon.match;

import com.vibedeutsch.backend.lexicon.store.SenseKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 多候選排序：(tier asc, similarity desc, frequency desc, 插入順序)。
 * 依 Lemma/Sense 分組，同拼字不同義項不合併。
 */
public class AmbiguityAggregator {

    private record Indexed(int order, ResolutionCandidate c) {}

    private static final Comparator<Indexed> RANKING =
            Comparator.comparingInt((Indexed i) -> i.c().tier().ordinal())
                    .thenComparing(Comparator.comparingDouble((Indexed i) -> i.c().similarity()).reversed())
                    .thenComparing(Comparator.comparingInt((Indexed i) -> i.c().lemma().frequencyRank()).reversed())
                    .thenComparingInt(Indexed::order);

    public RankedResultSet aggregate(List<ResolutionCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) return new RankedResultSet(List.of());

        // 同一個義項只留最好的那筆
        Map<SenseKey, Indexed> best = new LinkedHashMap<>();
        int order = 0;
        for (ResolutionCandidate c : candidates) {
            if (c == null) continue;
            Indexed next = new Indexed(order++, c);
            best.merge(c.key(), next, (a, b) -> RANKING.compare(a, b) <= 0 ? a : b);
        }

        List<Indexed> sorted = new ArrayList<>(best.values());
        sorted.sort(RANKING);

        List<RankedResultSet.Ranked> out = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            out.add(new RankedResultSet.Ranked(i + 1, sorted.get(i).c()));
        }
        return new RankedResultSet(List.copyOf(out));
    }
}
