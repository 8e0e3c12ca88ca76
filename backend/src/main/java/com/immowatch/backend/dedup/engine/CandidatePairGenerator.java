package com.immowatch.backend.dedup.engine;

import com.immowatch.backend.dedup.model.BlockingResult;
import com.immowatch.backend.dedup.model.CandidatePair;
import com.immowatch.backend.dedup.model.DetectionConfig;
import com.immowatch.backend.dedup.model.NormalizedListing;
import com.immowatch.backend.dedup.model.OversizedBlockWarning;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * Blocking stage. Only listings sharing a key are compared:
 * <ul>
 *   <li>{@code city|p:<n>}: same canonical city, price rounded to the same price bucket</li>
 *   <li>{@code city|s:<n>}: same canonical city, surface rounded to the same surface bucket</li>
 *   <li>{@code city|*}: a listing with neither price nor surface, paired with every other listing of its city</li>
 * </ul>
 * Oversized blocks are compared in full and reported as warnings.
 */
@Slf4j
public class CandidatePairGenerator {

    static final String UNKNOWN_CITY = "?";

    private final double priceBucketSize;
    private final double surfaceBucketSize;
    private final int maxBlockSize;

    public CandidatePairGenerator(DetectionConfig config) {
        this.priceBucketSize = config.getPriceBucketSize();
        this.surfaceBucketSize = config.getSurfaceBucketSize();
        this.maxBlockSize = config.getMaxBlockSize();
    }

    public BlockingResult generate(List<NormalizedListing> listings) {
        List<NormalizedListing> sorted = new ArrayList<>(listings);
        sorted.sort(Comparator.comparing(NormalizedListing::getId));

        Map<String, List<String>> blocks = new TreeMap<>();
        Map<String, List<String>> idsByCity = new TreeMap<>();
        Map<String, Set<String>> sparseByCity = new TreeMap<>();

        for (NormalizedListing listing : sorted) {
            String city = listing.hasCity() ? listing.getCity() : UNKNOWN_CITY;
            idsByCity.computeIfAbsent(city, k -> new ArrayList<>()).add(listing.getId());

            if (listing.hasPrice()) {
                blocks.computeIfAbsent(priceKey(city, listing.getPrice()), k -> new ArrayList<>()).add(listing.getId());
            }
            if (listing.hasSurface()) {
                blocks.computeIfAbsent(surfaceKey(city, listing.getSurface()), k -> new ArrayList<>()).add(listing.getId());
            }
            if (!listing.hasPrice() && !listing.hasSurface()) {
                sparseByCity.computeIfAbsent(city, k -> new HashSet<>()).add(listing.getId());
            }
        }

        Set<CandidatePair> pairs = new TreeSet<>();
        List<OversizedBlockWarning> warnings = new ArrayList<>();
        for (Map.Entry<String, List<String>> block : blocks.entrySet()) {
            List<String> ids = block.getValue();
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    pairs.add(CandidatePair.of(ids.get(i), ids.get(j)));
                }
            }
            checkSize(block.getKey(), ids.size(), (long) ids.size() * (ids.size() - 1) / 2, warnings);
        }

        // City-wide blocks only pair a sparse listing with its city; two priced listings never meet here
        for (Map.Entry<String, Set<String>> sparse : sparseByCity.entrySet()) {
            List<String> ids = idsByCity.get(sparse.getKey());
            Set<String> anchors = sparse.getValue();
            long comparisons = 0;
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    if (anchors.contains(ids.get(i)) || anchors.contains(ids.get(j))) {
                        pairs.add(CandidatePair.of(ids.get(i), ids.get(j)));
                        comparisons++;
                    }
                }
            }
            checkSize(sparse.getKey() + "|*", ids.size(), comparisons, warnings);
        }

        log.debug("Blocking produced {} blocks and {} candidate pairs for {} listings",
                blocks.size() + sparseByCity.size(), pairs.size(), sorted.size());
        return new BlockingResult(Collections.unmodifiableSet(pairs), List.copyOf(warnings));
    }

    private void checkSize(String blockKey, int blockSize, long comparisons, List<OversizedBlockWarning> warnings) {
        if (blockSize <= maxBlockSize) {
            return;
        }
        warnings.add(new OversizedBlockWarning(blockKey, blockSize, maxBlockSize, comparisons));
        log.warn("⚠️ Block '{}' holds {} listings (max {}), comparing all {} pairs",
                blockKey, blockSize, maxBlockSize, comparisons);
    }

    String priceKey(String city, double price) {
        return city + "|p:" + Math.round(price / priceBucketSize);
    }

    String surfaceKey(String city, double surface) {
        return city + "|s:" + Math.round(surface / surfaceBucketSize);
    }
}
