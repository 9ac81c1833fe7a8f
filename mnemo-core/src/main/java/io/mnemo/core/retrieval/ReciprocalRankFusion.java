package io.mnemo.core.retrieval;

import io.mnemo.core.vector.ScoredPoint;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Ties fall back to the number of rankings containing the id, then to first appearance.
public final class ReciprocalRankFusion {
    public static final int DEFAULT_K = 60;

    private final int k;

    public ReciprocalRankFusion() {
        this(DEFAULT_K);
    }

    public ReciprocalRankFusion(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        this.k = k;
    }

    public int k() {
        return k;
    }

    public List<FusedHit> fuse(List<List<ScoredPoint>> rankings) {
        Map<String, Accumulator> byId = new LinkedHashMap<>();
        int order = 0;
        for (int list = 0; list < rankings.size(); list++) {
            int rank = 0;
            for (ScoredPoint point : rankings.get(list)) {
                rank++;
                Accumulator acc = byId.get(point.id());
                if (acc == null) {
                    acc = new Accumulator(point.id(), order++, point.payload());
                    byId.put(point.id(), acc);
                } else if (acc.lastRanking == list) {
                    // duplicate id inside one ranking, keep its best rank only
                    continue;
                }
                acc.score += 1.0 / (rank + k);
                acc.lists++;
                acc.lastRanking = list;
            }
        }

        List<Accumulator> sorted = new ArrayList<>(byId.values());
        sorted.sort(Comparator.comparingDouble((Accumulator acc) -> acc.score).reversed()
            .thenComparing(Comparator.comparingInt((Accumulator acc) -> acc.lists).reversed())
            .thenComparingInt(acc -> acc.firstSeen));

        List<FusedHit> fused = new ArrayList<>(sorted.size());
        for (Accumulator acc : sorted) {
            fused.add(new FusedHit(acc.id, acc.score, acc.lists, acc.payload));
        }
        return fused;
    }

    private static final class Accumulator {
        private final String id;
        private final int firstSeen;
        private final Map<String, Object> payload;
        private double score;
        private int lists;
        private int lastRanking = -1;

        private Accumulator(String id, int firstSeen, Map<String, Object> payload) {
            this.id = id;
            this.firstSeen = firstSeen;
            this.payload = payload;
        }
    }
}
