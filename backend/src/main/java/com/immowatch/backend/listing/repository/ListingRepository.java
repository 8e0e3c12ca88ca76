package com.immowatch.backend.listing.repository;

import com.immowatch.backend.listing.entity.ListingEntity;
import com.immowatch.backend.model.enums.ListingSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ListingRepository extends JpaRepository<ListingEntity, String> {

    Long countBySource(ListingSource source);
}
