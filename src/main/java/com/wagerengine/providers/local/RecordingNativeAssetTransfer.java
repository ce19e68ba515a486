package com.wagerengine.providers.local;

import com.wagerengine.providers.NativeAssetTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Native asset rail that records outbound transfers in the engine database.
 *
 * In production this would submit a transfer to the host chain or payment network;
 * here the record commits or rolls back together with the request.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecordingNativeAssetTransfer implements NativeAssetTransfer {

    private final NativeTransferRepository transferRepository;

    @Override
    @Transactional
    public void transfer(String recipient, long nativeAmount, String reason) {
        transferRepository.save(new NativeTransfer(recipient, nativeAmount, reason));
        log.info("Transferred {} native to {} ({})", nativeAmount, recipient, reason);
    }

    @Transactional(readOnly = true)
    public long totalTransferredTo(String recipient) {
        return transferRepository.sumByRecipient(recipient);
    }
}
