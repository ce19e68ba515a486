package com.wagerengine.providers.local;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface PeggedHoldingRepository extends JpaRepository<PeggedHolding, String> {

    @Query("select coalesce(sum(h.units), 0) from PeggedHolding h")
    long sumUnits();
}
