package com.wagerengine.providers;

/**
 * Identity and statistics service.
 *
 * Decides whether an identity may transact (registered and not banned) and keeps
 * per-identity game and deposit statistics. Stat updates are privileged: the engine
 * identity must hold {@link com.wagerengine.access.Role#GAME_MANAGER}.
 */
public interface IdentityRegistry {

    /**
     * Stand-in used when no registry is linked: every identity is valid and stat
     * reports are dropped.
     */
    IdentityRegistry UNLINKED = new IdentityRegistry() {
        @Override
        public boolean isValid(String identity) {
            return true;
        }

        @Override
        public void recordGameStat(String identity, boolean won, long amount) {
        }

        @Override
        public void recordDepositStat(String identity, long amount, boolean isDeposit) {
        }
    };

    boolean isValid(String identity);

    void recordGameStat(String identity, boolean won, long amount);

    /**
     * @param amount native units moved
     * @param isDeposit true for a deposit, false for a withdrawal
     */
    void recordDepositStat(String identity, long amount, boolean isDeposit);
}
