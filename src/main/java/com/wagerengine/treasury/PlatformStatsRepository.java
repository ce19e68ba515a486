package com.wagerengine.treasury;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the platform stats record.
 */
@Repository
public interface PlatformStatsRepository extends JpaRepository<PlatformStats, String> {
}
