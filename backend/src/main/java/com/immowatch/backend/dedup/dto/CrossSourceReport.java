package com.immowatch.backend.dedup.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrossSourceReport {
    // Canonical ids of clusters whose listings all come from one site
    private List<String> onlySeloger;
    private List<String> onlyLeboncoin;
    private int sharedProperties;
    private List<ListingMismatch> mismatches;
}
