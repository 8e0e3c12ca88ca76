package com.immowatch.backend.dedup.dto;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One SeLoger listing and one LeBoncoin listing grouped as the same property but reporting different values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ListingMismatch {
    private String canonicalId;
    private String selogerId;
    private String leboncoinId;
    private String selogerUrl;
    private String leboncoinUrl;
    private Map<String, FieldDifference> differences;
}
