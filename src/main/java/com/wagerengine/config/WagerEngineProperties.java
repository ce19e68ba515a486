package com.wagerengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Startup configuration of the engine.
 * Values are applied once, when the control record is first created.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "wager-engine")
public class WagerEngineProperties {

    /**
     * Identity allowed to run administrative operations.
     */
    private String owner = "owner";

    /**
     * Sink for withdrawn platform fees. Blank means unset.
     */
    private String treasury;

    /**
     * Identity the engine holds custody and capabilities under.
     */
    private String engineIdentity = "wager-engine";

    private Links links = new Links();

    /**
     * Game configurations seeded on first start, keyed by game-type tag.
     */
    private Map<String, GameDefaults> games = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Links {
        /**
         * Bean name of the minter to link at startup, blank for none.
         */
        private String minter;

        /**
         * Bean name of the identity registry to link at startup, blank for none.
         */
        private String registry;
    }

    @Getter
    @Setter
    public static class GameDefaults {
        private long minBet;
        private long maxBet;
        private long payoutMultiplierBps;
        private boolean active = true;
        private String displayName;
    }
}
