package com.immowatch.backend.listing.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResultDTO {
    private int received;
    private int inserted;
    private int updated;
    private List<String> skipped;
}
