package com.immowatch.backend.dedup.engine;

import com.immowatch.backend.dedup.model.CandidatePair;
import com.immowatch.backend.dedup.model.Cluster;
import com.immowatch.backend.dedup.model.EvidenceSummary;
import com.immowatch.backend.dedup.model.PairEvidence;
import com.immowatch.backend.dedup.model.SimilarityScore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the per-cluster evidence. Confidence is the weakest scored link inside the cluster,
 * 1.0 when nothing inside it was scored.
 */
public class EvidenceReporter {

    private final double threshold;

    public EvidenceReporter(double threshold) {
        this.threshold = threshold;
    }

    public EvidenceSummary summarize(Cluster cluster, Map<CandidatePair, SimilarityScore> scores) {
        Set<String> members = new HashSet<>(cluster.getMemberIds());
        List<SimilarityScore> intraCluster = new ArrayList<>();
        for (SimilarityScore score : new TreeMap<>(scores).values()) {
            CandidatePair pair = score.getPair();
            if (members.contains(pair.getFirst()) && members.contains(pair.getSecond())) {
                intraCluster.add(score);
            }
        }
        return toSummary(cluster, intraCluster);
    }

    /**
     * Summaries for a whole partition, indexing the scores once instead of once per cluster.
     */
    public List<EvidenceSummary> summarizeAll(List<Cluster> clusters, Map<CandidatePair, SimilarityScore> scores) {
        Map<String, Integer> clusterOf = new HashMap<>();
        for (int i = 0; i < clusters.size(); i++) {
            for (String id : clusters.get(i).getMemberIds()) {
                clusterOf.put(id, i);
            }
        }
        Map<Integer, List<SimilarityScore>> byCluster = new HashMap<>();
        for (SimilarityScore score : new TreeMap<>(scores).values()) {
            Integer first = clusterOf.get(score.getPair().getFirst());
            if (first != null && first.equals(clusterOf.get(score.getPair().getSecond()))) {
                byCluster.computeIfAbsent(first, k -> new ArrayList<>()).add(score);
            }
        }

        List<EvidenceSummary> summaries = new ArrayList<>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            summaries.add(toSummary(clusters.get(i), byCluster.getOrDefault(i, List.of())));
        }
        return summaries;
    }

    private EvidenceSummary toSummary(Cluster cluster, List<SimilarityScore> intraCluster) {
        List<PairEvidence> evidence = new ArrayList<>(intraCluster.size());
        double confidence = 1.0;
        for (SimilarityScore score : intraCluster) {
            confidence = Math.min(confidence, score.getScore());
            evidence.add(PairEvidence.builder()
                    .firstId(score.getPair().getFirst())
                    .secondId(score.getPair().getSecond())
                    .score(score.getScore())
                    .accepted(score.exceedsThreshold(threshold))
                    .breakdown(score.getBreakdown())
                    .matchedFeatures(score.getMatchedFeatures())
                    .build());
        }
        return EvidenceSummary.builder()
                .memberIds(cluster.getMemberIds())
                .canonicalId(cluster.getCanonicalId())
                .confidence(confidence)
                .pairEvidence(List.copyOf(evidence))
                .build();
    }
}
