package com.wagerengine.accounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/**
 * Repository for player accounts.
 */
@Repository
public interface PlayerAccountRepository extends JpaRepository<PlayerAccount, String> {

    @Query("select coalesce(sum(a.balance), 0) from PlayerAccount a")
    long sumBalances();
}
