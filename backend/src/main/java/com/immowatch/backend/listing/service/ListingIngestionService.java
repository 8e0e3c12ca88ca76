package com.immowatch.backend.listing.service;

import com.immowatch.backend.dedup.model.Listing;
import com.immowatch.backend.listing.dto.IngestionResultDTO;
import com.immowatch.backend.listing.dto.ListingDTO;
import com.immowatch.backend.listing.entity.ListingEntity;
import com.immowatch.backend.listing.repository.ListingRepository;
import com.immowatch.backend.model.enums.AdvertiserType;
import com.immowatch.backend.model.enums.ListingKind;
import com.immowatch.backend.model.enums.ListingSource;
import com.immowatch.backend.model.enums.MockDataMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ingestion side of the listing store: upserts scraped rows and hands stored rows to the detection engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class ListingIngestionService {

    private final ListingRepository listingRepository;
    private final MockListingGenerator mockListingGenerator;

    /**
     * Insert new rows and overwrite rows whose id already exists. Rows whose site cannot be
     * resolved from either the source name or the url are skipped.
     */
    public IngestionResultDTO upsertListings(List<ListingDTO> rows) {
        log.info("Ingesting {} scraped listings", rows.size());

        Map<String, ListingDTO> byId = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        for (ListingDTO row : rows) {
            ListingSource source = resolveSource(row);
            if (source == null) {
                String label = row.getUrl() != null ? row.getUrl() : row.getTitle();
                log.warn("⚠️ Skipping listing with unknown source: {}", label);
                skipped.add(label);
                continue;
            }
            String id = row.getId() != null && !row.getId().isBlank()
                    ? row.getId().trim()
                    : ListingIds.stableId(source, row.getUrl(), row.getTitle());
            // Last occurrence wins, like an upsert replayed in order
            byId.put(id, row);
        }
        if (byId.isEmpty()) {
            return new IngestionResultDTO(rows.size(), 0, 0, skipped);
        }

        Map<String, ListingEntity> existing = listingRepository.findAllById(byId.keySet()).stream()
                .collect(Collectors.toMap(ListingEntity::getId, Function.identity()));

        List<ListingEntity> toSave = new ArrayList<>(byId.size());
        for (Map.Entry<String, ListingDTO> entry : byId.entrySet()) {
            ListingEntity entity = existing.getOrDefault(entry.getKey(), new ListingEntity());
            entity.setId(entry.getKey());
            applyRow(entity, entry.getValue());
            toSave.add(entity);
        }
        listingRepository.saveAll(toSave);

        int updated = existing.size();
        int inserted = toSave.size() - updated;
        log.info("💾 Stored listings: {} inserted, {} updated, {} skipped", inserted, updated, skipped.size());
        return new IngestionResultDTO(rows.size(), inserted, updated, skipped);
    }

    /**
     * Generate and store synthetic listings with cross-source duplicates, plus a few curated pairs.
     */
    public IngestionResultDTO seedMockListings(MockDataMode mode, int total, double duplicateRatio, long seed) {
        List<ListingDTO> rows = new ArrayList<>(mode == MockDataMode.EXACT
                ? mockListingGenerator.generateMockRows(total, duplicateRatio, seed)
                : mockListingGenerator.generateEnhancedDuplicates(total, duplicateRatio, seed));
        rows.addAll(mockListingGenerator.generateCuratedDuplicates(4, seed));
        return upsertListings(rows);
    }

    @Transactional(readOnly = true)
    public List<Listing> loadAll() {
        return listingRepository.findAll().stream()
                .map(ListingIngestionService::toListing)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Page<ListingEntity> getListings(Pageable pageable) {
        return listingRepository.findAll(pageable);
    }

    @Transactional(readOnly = true)
    public Map<String, Object> getListingStats() {
        Long seloger = listingRepository.countBySource(ListingSource.SELOGER);
        Long leboncoin = listingRepository.countBySource(ListingSource.LEBONCOIN);
        return Map.of(
                "totalListings", listingRepository.count(),
                "seloger", seloger != null ? seloger : 0,
                "leboncoin", leboncoin != null ? leboncoin : 0
        );
    }

    public long clear() {
        long count = listingRepository.count();
        listingRepository.deleteAllInBatch();
        log.info("🗑️ Cleared {} stored listings", count);
        return count;
    }

    public static Listing toListing(ListingEntity entity) {
        return Listing.builder()
                .id(entity.getId())
                .source(entity.getSource())
                .title(entity.getTitle())
                .city(entity.getCity())
                .price(entity.getPrice())
                .surface(entity.getSurface())
                .rooms(entity.getRooms())
                .kind(entity.getKind())
                .advertiser(entity.getAdvertiser())
                .description(entity.getDescription())
                .ingestedAt(entity.getScrapedAt() != null ? entity.getScrapedAt() : entity.getCreatedAt())
                .url(entity.getUrl())
                .postalCode(entity.getPostalCode())
                .propertyType(entity.getPropertyType())
                .build();
    }

    /**
     * Maps a posted row as-is. No id is derived here: a row without one is rejected by the engine.
     */
    public static Listing toListing(ListingDTO row) {
        return Listing.builder()
                .id(row.getId())
                .source(resolveSource(row))
                .title(row.getTitle())
                .city(row.getCity())
                .price(row.getPrice())
                .surface(row.getSurface())
                .rooms(row.getRooms())
                .kind(ListingKind.fromLabel(row.getListingType()))
                .advertiser(AdvertiserType.fromLabel(row.getAgencyOrPrivate()))
                .description(row.getDescription())
                .ingestedAt(row.getScrapedAt())
                .url(row.getUrl())
                .postalCode(row.getPostalCode())
                .propertyType(row.getPropertyType())
                .build();
    }

    private static ListingSource resolveSource(ListingDTO row) {
        ListingSource source = ListingSource.fromSiteLabel(row.getSource());
        return source != null ? source : ListingSource.fromAdUrl(row.getUrl());
    }

    private static void applyRow(ListingEntity entity, ListingDTO row) {
        entity.setSource(resolveSource(row));
        entity.setTitle(row.getTitle());
        entity.setUrl(row.getUrl());
        entity.setPrice(row.getPrice());
        entity.setCity(row.getCity());
        entity.setPostalCode(row.getPostalCode());
        entity.setKind(ListingKind.fromLabel(row.getListingType()));
        entity.setPropertyType(row.getPropertyType());
        entity.setRooms(row.getRooms());
        entity.setSurface(row.getSurface());
        entity.setAdvertiser(AdvertiserType.fromLabel(row.getAgencyOrPrivate()));
        entity.setDescription(row.getDescription());
        entity.setScrapedAt(row.getScrapedAt());
    }
}
