package com.immowatch.backend.dedup.service;

import com.immowatch.backend.dedup.dto.CrossSourceReport;
import com.immowatch.backend.dedup.dto.FieldDifference;
import com.immowatch.backend.dedup.dto.ListingMismatch;
import com.immowatch.backend.dedup.model.DuplicateDetectionResult;
import com.immowatch.backend.dedup.model.EvidenceSummary;
import com.immowatch.backend.dedup.model.Listing;
import com.immowatch.backend.model.enums.ListingSource;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Compares the two sites over a finished detection run: properties listed on one site only, and
 * field values that disagree between the SeLoger and LeBoncoin listings of the same property.
 */
@Slf4j
@Service
public class CrossSourceDiffService {

    private static final Map<String, Function<Listing, Object>> KEY_FIELDS = keyFields();

    public CrossSourceReport compare(List<Listing> listings, DuplicateDetectionResult result) {
        Map<String, Listing> byId = listings.stream()
                .filter(Objects::nonNull)
                .filter(l -> l.getId() != null)
                .collect(Collectors.toMap(Listing::getId, Function.identity(), (first, second) -> first));

        List<String> onlySeloger = new ArrayList<>();
        List<String> onlyLeboncoin = new ArrayList<>();
        List<ListingMismatch> mismatches = new ArrayList<>();
        int shared = 0;

        for (EvidenceSummary summary : result.getSummaries()) {
            List<Listing> seloger = membersFrom(summary, byId, ListingSource.SELOGER);
            List<Listing> leboncoin = membersFrom(summary, byId, ListingSource.LEBONCOIN);

            if (leboncoin.isEmpty() && !seloger.isEmpty()) {
                onlySeloger.add(summary.getCanonicalId());
            } else if (seloger.isEmpty() && !leboncoin.isEmpty()) {
                onlyLeboncoin.add(summary.getCanonicalId());
            } else if (!seloger.isEmpty()) {
                shared++;
                for (Listing se : seloger) {
                    for (Listing lb : leboncoin) {
                        Map<String, FieldDifference> differences = differences(se, lb);
                        if (!differences.isEmpty()) {
                            mismatches.add(new ListingMismatch(summary.getCanonicalId(), se.getId(), lb.getId(),
                                    se.getUrl(), lb.getUrl(), differences));
                        }
                    }
                }
            }
        }

        log.info("📊 Cross-source report: {} only on SeLoger, {} only on LeBoncoin, {} shared, {} mismatching pairs",
                onlySeloger.size(), onlyLeboncoin.size(), shared, mismatches.size());
        return CrossSourceReport.builder()
                .onlySeloger(onlySeloger)
                .onlyLeboncoin(onlyLeboncoin)
                .sharedProperties(shared)
                .mismatches(mismatches)
                .build();
    }

    Map<String, FieldDifference> differences(Listing seloger, Listing leboncoin) {
        Map<String, FieldDifference> differences = new LinkedHashMap<>();
        for (Map.Entry<String, Function<Listing, Object>> field : KEY_FIELDS.entrySet()) {
            Object se = field.getValue().apply(seloger);
            Object lb = field.getValue().apply(leboncoin);
            if (se == null && lb == null) {
                continue;
            }
            if (!sameValue(se, lb)) {
                differences.put(field.getKey(), new FieldDifference(se, lb));
            }
        }
        return differences;
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof BigDecimal && b instanceof BigDecimal) {
            return ((BigDecimal) a).compareTo((BigDecimal) b) == 0;
        }
        return Objects.equals(a, b);
    }

    private static List<Listing> membersFrom(EvidenceSummary summary, Map<String, Listing> byId, ListingSource source) {
        return summary.getMemberIds().stream()
                .map(byId::get)
                .filter(Objects::nonNull)
                .filter(l -> l.getSource() == source)
                .collect(Collectors.toList());
    }

    private static Map<String, Function<Listing, Object>> keyFields() {
        Map<String, Function<Listing, Object>> fields = new LinkedHashMap<>();
        fields.put("title", Listing::getTitle);
        fields.put("city", Listing::getCity);
        fields.put("postalCode", Listing::getPostalCode);
        fields.put("kind", Listing::getKind);
        fields.put("propertyType", Listing::getPropertyType);
        fields.put("rooms", Listing::getRooms);
        fields.put("surface", Listing::getSurface);
        fields.put("price", Listing::getPrice);
        fields.put("advertiser", Listing::getAdvertiser);
        return fields;
    }
}
