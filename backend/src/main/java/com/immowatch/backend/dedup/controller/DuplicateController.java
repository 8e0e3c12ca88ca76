package com.immowatch.backend.dedup.controller;

import com.immowatch.backend.config.DedupProperties;
import com.immowatch.backend.dedup.dto.CrossSourceReport;
import com.immowatch.backend.dedup.dto.DetectionRequestDTO;
import com.immowatch.backend.dedup.exception.ConfigurationException;
import com.immowatch.backend.dedup.model.DetectionConfig;
import com.immowatch.backend.dedup.model.DuplicateDetectionResult;
import com.immowatch.backend.dedup.model.Listing;
import com.immowatch.backend.dedup.service.CrossSourceCsvExporter;
import com.immowatch.backend.dedup.service.CrossSourceDiffService;
import com.immowatch.backend.dedup.service.DuplicateDetectionService;
import com.immowatch.backend.listing.service.ListingIngestionService;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Duplicate groups for the dashboard
 */
@Slf4j
@RestController
@RequestMapping("/api/duplicates")
@RequiredArgsConstructor
public class DuplicateController {

    static final String CSV_FILENAME = "cross-source-diff.csv";
    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final DuplicateDetectionService detectionService;
    private final CrossSourceDiffService diffService;
    private final CrossSourceCsvExporter csvExporter;
    private final ListingIngestionService ingestionService;
    private final DedupProperties dedupProperties;

    /**
     * Detect duplicates over every stored listing with the configured defaults
     */
    @GetMapping
    public ResponseEntity<?> detectStoredDuplicates() {
        try {
            List<Listing> listings = ingestionService.loadAll();
            DuplicateDetectionResult result = detectionService.detectDuplicates(listings);
            return ResponseEntity.ok(result);
        } catch (ConfigurationException e) {
            log.error("❌ Invalid dedup configuration: {}", e.getMessage());
            return errorResponse(HttpStatus.BAD_REQUEST, "Invalid detection configuration", e);
        } catch (Exception e) {
            log.error("❌ Duplicate detection failed", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Duplicate detection failed", e);
        }
    }

    /**
     * Detect duplicates over a posted batch, optionally overriding settings
     */
    @PostMapping("/detect")
    public ResponseEntity<?> detectDuplicates(@Valid @RequestBody DetectionRequestDTO request) {
        log.info("🚀 Ad-hoc duplicate detection over {} posted listings", request.getListings().size());
        try {
            DetectionConfig config = applyOverrides(dedupProperties.toDetectionConfig(), request);
            List<Listing> listings = request.getListings().stream()
                    .map(ListingIngestionService::toListing)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(detectionService.detectDuplicates(listings, config));
        } catch (ConfigurationException e) {
            log.error("❌ Invalid detection configuration: {}", e.getMessage());
            return errorResponse(HttpStatus.BAD_REQUEST, "Invalid detection configuration", e);
        } catch (Exception e) {
            log.error("❌ Duplicate detection failed", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Duplicate detection failed", e);
        }
    }

    /**
     * Listings present on one site only, and disagreements between the sites for shared properties
     */
    @GetMapping("/diff")
    public ResponseEntity<?> crossSourceDiff() {
        try {
            List<Listing> listings = ingestionService.loadAll();
            DuplicateDetectionResult result = detectionService.detectDuplicates(listings);
            CrossSourceReport report = diffService.compare(listings, result);
            return ResponseEntity.ok(report);
        } catch (ConfigurationException e) {
            log.error("❌ Invalid dedup configuration: {}", e.getMessage());
            return errorResponse(HttpStatus.BAD_REQUEST, "Invalid detection configuration", e);
        } catch (Exception e) {
            log.error("❌ Cross-source diff failed", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Cross-source diff failed", e);
        }
    }

    /**
     * The cross-source diff as a CSV download
     */
    @GetMapping("/diff/csv")
    public ResponseEntity<?> exportCrossSourceDiff() {
        try {
            List<Listing> listings = ingestionService.loadAll();
            DuplicateDetectionResult result = detectionService.detectDuplicates(listings);
            String csv = csvExporter.toCsv(diffService.compare(listings, result));
            return ResponseEntity.ok()
                    .contentType(TEXT_CSV)
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + CSV_FILENAME + "\"")
                    .body(csv);
        } catch (ConfigurationException e) {
            log.error("❌ Invalid dedup configuration: {}", e.getMessage());
            return errorResponse(HttpStatus.BAD_REQUEST, "Invalid detection configuration", e);
        } catch (Exception e) {
            log.error("❌ Cross-source diff export failed", e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Cross-source diff export failed", e);
        }
    }

    static DetectionConfig applyOverrides(DetectionConfig defaults, DetectionRequestDTO request) {
        DetectionConfig.DetectionConfigBuilder builder = defaults.toBuilder();
        if (request.getSimilarityThreshold() != null) {
            builder.similarityThreshold(request.getSimilarityThreshold());
        }
        if (request.getFeatureWeights() != null) {
            builder.featureWeights(DedupProperties.parseWeights(request.getFeatureWeights()));
        }
        if (request.getPriceBucketSize() != null) {
            builder.priceBucketSize(request.getPriceBucketSize());
        }
        if (request.getSurfaceBucketSize() != null) {
            builder.surfaceBucketSize(request.getSurfaceBucketSize());
        }
        if (request.getMaxBlockSize() != null) {
            builder.maxBlockSize(request.getMaxBlockSize());
        }
        if (request.getCityAliases() != null) {
            builder.cityAliases(Map.copyOf(request.getCityAliases()));
        }
        if (request.getParallelScoring() != null) {
            builder.parallelScoring(request.getParallelScoring());
        }
        return builder.build();
    }

    private static ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error, Exception e) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", String.valueOf(e.getMessage()),
                "timestamp", System.currentTimeMillis()
        ));
    }
}
