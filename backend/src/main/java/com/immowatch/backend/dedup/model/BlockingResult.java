package com.immowatch.backend.dedup.model;

import java.util.List;
import java.util.Set;
import lombok.Value;

@Value
public class BlockingResult {
    Set<CandidatePair> pairs;
    List<OversizedBlockWarning> warnings;
}
