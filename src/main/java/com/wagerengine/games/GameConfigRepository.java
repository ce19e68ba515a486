package com.wagerengine.games;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for game configurations.
 */
@Repository
public interface GameConfigRepository extends JpaRepository<GameConfig, String> {

    List<GameConfig> findAllByOrderByGameTypeAsc();
}
