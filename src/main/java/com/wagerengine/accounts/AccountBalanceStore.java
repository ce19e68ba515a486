package com.wagerengine.accounts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Identity to pegged balance mapping; the single source of truth for spendable funds.
 *
 * Mutations are only reachable from the deposit/withdrawal processor and the
 * settlement engine, inside their transactions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountBalanceStore {

    private final PlayerAccountRepository accountRepository;

    /**
     * @return the balance, or 0 for an identity that never deposited
     */
    @Transactional(readOnly = true)
    public long balanceOf(String identity) {
        return accountRepository.findById(identity)
            .map(PlayerAccount::getBalance)
            .orElse(0L);
    }

    @Transactional
    public PlayerAccount credit(String identity, long amount) {
        PlayerAccount account = accountRepository.findById(identity)
            .orElseGet(() -> {
                log.info("Opening account for {}", identity);
                return new PlayerAccount(identity);
            });
        account.credit(amount);
        return accountRepository.save(account);
    }

    /**
     * Debit an existing account. An identity without an account is treated as a zero
     * balance and no account is opened for it.
     */
    @Transactional
    public PlayerAccount debit(String identity, long amount) {
        Optional<PlayerAccount> existing = accountRepository.findById(identity);
        if (existing.isEmpty()) {
            PlayerAccount empty = new PlayerAccount(identity);
            empty.debit(amount);
            return empty;
        }
        PlayerAccount account = existing.get();
        account.debit(amount);
        return accountRepository.save(account);
    }

    /**
     * Sum of every account balance: the engine's total pegged liability.
     */
    @Transactional
    public long totalLiabilities() {
        return accountRepository.sumBalances();
    }
}
