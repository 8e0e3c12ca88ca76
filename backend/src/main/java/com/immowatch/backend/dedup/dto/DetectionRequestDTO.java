package com.immowatch.backend.dedup.dto;

import com.immowatch.backend.listing.dto.ListingDTO;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ad-hoc detection over a posted batch. Every setting left null keeps its configured default.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRequestDTO {
    @NotNull
    @Valid
    private List<ListingDTO> listings;

    private Double similarityThreshold;
    private Map<String, Double> featureWeights;
    private Double priceBucketSize;
    private Double surfaceBucketSize;
    private Integer maxBlockSize;
    private Map<String, String> cityAliases;
    private Boolean parallelScoring;
}
