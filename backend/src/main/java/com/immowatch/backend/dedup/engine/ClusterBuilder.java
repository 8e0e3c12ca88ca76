package com.immowatch.backend.dedup.engine;

import com.immowatch.backend.dedup.model.CandidatePair;
import com.immowatch.backend.dedup.model.Cluster;
import com.immowatch.backend.dedup.model.NormalizedListing;
import com.immowatch.backend.dedup.model.SimilarityScore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;

/**
 * Groups listings transitively over the pairs that reach the threshold.
 * <p>
 * Identifiers are remapped to dense indexes in sorted order, so neither the order of the listings
 * nor the order of the pairs changes the partition or the canonical choice.
 */
@Slf4j
public class ClusterBuilder {

    /**
     * Most known fields first, then earliest ingestion (unknown last), then smallest identifier.
     */
    static final Comparator<NormalizedListing> CANONICAL_ORDER = Comparator
            .<NormalizedListing>comparingInt(listing -> -listing.getKnownFieldCount())
            .thenComparing(NormalizedListing::getIngestedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(NormalizedListing::getId);

    public List<Cluster> build(List<NormalizedListing> listings,
                               Set<CandidatePair> pairs,
                               Map<CandidatePair, SimilarityScore> scores,
                               double threshold) {
        TreeMap<String, NormalizedListing> byId = new TreeMap<>();
        for (NormalizedListing listing : listings) {
            if (byId.put(listing.getId(), listing) != null) {
                throw new IllegalArgumentException("Listing " + listing.getId() + " given twice");
            }
        }

        List<String> ids = new ArrayList<>(byId.keySet());
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            index.put(ids.get(i), i);
        }

        UnionFind unionFind = new UnionFind(ids.size());
        int accepted = 0;
        for (CandidatePair pair : pairs) {
            SimilarityScore score = scores.get(pair);
            if (score == null) {
                log.debug("Pair {} has no score, skipped", pair);
                continue;
            }
            if (score.exceedsThreshold(threshold)) {
                unionFind.union(indexOf(index, pair.getFirst()), indexOf(index, pair.getSecond()));
                accepted++;
            }
        }

        // Members come out sorted because ids are visited in order
        Map<Integer, List<String>> members = new TreeMap<>();
        for (int i = 0; i < ids.size(); i++) {
            members.computeIfAbsent(unionFind.find(i), k -> new ArrayList<>()).add(ids.get(i));
        }

        Map<Integer, Double> weakestLink = new HashMap<>();
        for (CandidatePair pair : pairs) {
            SimilarityScore score = scores.get(pair);
            if (score == null) {
                continue;
            }
            int root = unionFind.find(indexOf(index, pair.getFirst()));
            if (root == unionFind.find(indexOf(index, pair.getSecond()))) {
                weakestLink.merge(root, score.getScore(), Math::min);
            }
        }

        List<Cluster> clusters = new ArrayList<>(members.size());
        for (Map.Entry<Integer, List<String>> component : members.entrySet()) {
            List<String> memberIds = component.getValue();
            String canonical = memberIds.stream()
                    .map(byId::get)
                    .min(CANONICAL_ORDER)
                    .map(NormalizedListing::getId)
                    .orElseThrow();
            clusters.add(Cluster.builder()
                    .memberIds(List.copyOf(memberIds))
                    .canonicalId(canonical)
                    .confidence(weakestLink.getOrDefault(component.getKey(), 1.0))
                    .build());
        }
        clusters.sort(Comparator.comparing(Cluster::getCanonicalId));

        log.debug("Built {} clusters from {} listings ({} of {} pairs accepted at threshold {})",
                clusters.size(), ids.size(), accepted, pairs.size(), threshold);
        return clusters;
    }

    private static int indexOf(Map<String, Integer> index, String id) {
        Integer position = index.get(id);
        if (position == null) {
            throw new IllegalArgumentException("Candidate pair references unknown listing " + id);
        }
        return position;
    }
}
