package com.immowatch.backend.dedup.service;

import com.immowatch.backend.config.DedupProperties;
import com.immowatch.backend.dedup.engine.CandidatePairGenerator;
import com.immowatch.backend.dedup.engine.ClusterBuilder;
import com.immowatch.backend.dedup.engine.EvidenceReporter;
import com.immowatch.backend.dedup.engine.ListingNormalizer;
import com.immowatch.backend.dedup.engine.ListingValidator;
import com.immowatch.backend.dedup.engine.SimilarityScorer;
import com.immowatch.backend.dedup.exception.InvalidListingException;
import com.immowatch.backend.dedup.model.BlockingResult;
import com.immowatch.backend.dedup.model.CandidatePair;
import com.immowatch.backend.dedup.model.Cluster;
import com.immowatch.backend.dedup.model.DetectionConfig;
import com.immowatch.backend.dedup.model.DuplicateDetectionResult;
import com.immowatch.backend.dedup.model.EvidenceSummary;
import com.immowatch.backend.dedup.model.Listing;
import com.immowatch.backend.dedup.model.NormalizedListing;
import com.immowatch.backend.dedup.model.RejectedListing;
import com.immowatch.backend.dedup.model.SimilarityScore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the duplicate detection pipeline:
 * validation, normalization, blocking, scoring, clustering, evidence.
 * <p>
 * Each call is a pure function of its listings and configuration. Nothing is cached between runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateDetectionService {

    private static final int PARALLEL_CHUNKS = 8;

    private final DedupProperties dedupProperties;
    private final Executor dedupTaskExecutor;
    private final ListingValidator validator = new ListingValidator();

    /**
     * Run with the defaults from application.yml
     */
    public DuplicateDetectionResult detectDuplicates(List<Listing> listings) {
        return detectDuplicates(listings, dedupProperties.toDetectionConfig());
    }

    /**
     * Partition listings into groups describing the same property.
     *
     * @throws com.immowatch.backend.dedup.exception.ConfigurationException before any work when the config is invalid
     */
    public DuplicateDetectionResult detectDuplicates(List<Listing> listings, DetectionConfig config) {
        config.validate();
        log.info("🔍 Starting duplicate detection over {} listings (threshold {})",
                listings.size(), config.getSimilarityThreshold());

        List<RejectedListing> rejected = new ArrayList<>();
        List<Listing> accepted = acceptListings(listings, rejected);

        ListingNormalizer normalizer = new ListingNormalizer(config);
        List<NormalizedListing> normalized = accepted.stream()
                .map(normalizer::normalize)
                .collect(Collectors.toList());
        Map<String, NormalizedListing> byId = normalized.stream()
                .collect(Collectors.toMap(NormalizedListing::getId, Function.identity()));

        BlockingResult blocking = new CandidatePairGenerator(config).generate(normalized);
        log.info("🧱 Blocking kept {} candidate pairs ({} oversized blocks)",
                blocking.getPairs().size(), blocking.getWarnings().size());

        SimilarityScorer scorer = new SimilarityScorer(config);
        Map<CandidatePair, SimilarityScore> scores = config.isParallelScoring()
                ? scoreInParallel(scorer, new ArrayList<>(blocking.getPairs()), byId)
                : scorer.scoreAll(blocking.getPairs(), byId);

        List<Cluster> clusters = new ClusterBuilder()
                .build(normalized, blocking.getPairs(), scores, config.getSimilarityThreshold());
        List<EvidenceSummary> summaries = new EvidenceReporter(config.getSimilarityThreshold())
                .summarizeAll(clusters, scores);

        DuplicateDetectionResult result = DuplicateDetectionResult.builder()
                .summaries(List.copyOf(summaries))
                .warnings(blocking.getWarnings())
                .rejected(List.copyOf(rejected))
                .acceptedCount(accepted.size())
                .candidatePairCount(blocking.getPairs().size())
                .build();
        log.info("✅ Duplicate detection done: {} listings -> {} clusters ({} duplicate groups), {} rejected",
                accepted.size(), summaries.size(), result.duplicateGroupCount(), rejected.size());
        return result;
    }

    /**
     * Drops listings that fail validation and every listing whose id occurs more than once,
     * so the accepted set does not depend on input order.
     */
    private List<Listing> acceptListings(List<Listing> listings, List<RejectedListing> rejected) {
        List<Listing> valid = new ArrayList<>();
        for (Listing listing : listings) {
            try {
                validator.validate(listing);
                valid.add(listing);
            } catch (InvalidListingException e) {
                log.warn("⚠️ Rejected listing {}: {}", e.getListingId(), e.getMessage());
                rejected.add(new RejectedListing(e.getListingId(), e.getMessage()));
            }
        }

        Map<String, Integer> occurrences = new HashMap<>();
        for (Listing listing : valid) {
            occurrences.merge(listing.getId(), 1, Integer::sum);
        }
        List<Listing> accepted = new ArrayList<>(valid.size());
        for (Listing listing : valid) {
            if (occurrences.get(listing.getId()) > 1) {
                InvalidListingException collision =
                        new InvalidListingException(listing.getId(), "identifier used by more than one listing in the batch");
                log.warn("⚠️ Rejected listing {}: {}", collision.getListingId(), collision.getMessage());
                rejected.add(new RejectedListing(collision.getListingId(), collision.getMessage()));
            } else {
                accepted.add(listing);
            }
        }
        return accepted;
    }

    /**
     * Pairs are scored independently, so chunks run on the executor and are merged back by pair key.
     */
    private Map<CandidatePair, SimilarityScore> scoreInParallel(SimilarityScorer scorer,
                                                                List<CandidatePair> pairs,
                                                                Map<String, NormalizedListing> byId) {
        if (pairs.isEmpty()) {
            return new TreeMap<>();
        }
        int chunkSize = Math.max(1, (pairs.size() + PARALLEL_CHUNKS - 1) / PARALLEL_CHUNKS);
        List<CompletableFuture<Map<CandidatePair, SimilarityScore>>> futures = new ArrayList<>();
        for (int start = 0; start < pairs.size(); start += chunkSize) {
            List<CandidatePair> chunk = pairs.subList(start, Math.min(pairs.size(), start + chunkSize));
            futures.add(CompletableFuture.supplyAsync(() -> scorer.scoreAll(chunk, byId), dedupTaskExecutor));
        }

        Map<CandidatePair, SimilarityScore> merged = new TreeMap<>();
        for (CompletableFuture<Map<CandidatePair, SimilarityScore>> future : futures) {
            merged.putAll(future.join());
        }
        log.debug("Scored {} pairs in {} parallel chunks", merged.size(), futures.size());
        return merged;
    }
}
