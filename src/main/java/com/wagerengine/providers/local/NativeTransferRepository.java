package com.wagerengine.providers.local;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface NativeTransferRepository extends JpaRepository<NativeTransfer, String> {

    @Query("select coalesce(sum(t.amount), 0) from NativeTransfer t where t.recipient = ?1")
    long sumByRecipient(String recipient);
}
