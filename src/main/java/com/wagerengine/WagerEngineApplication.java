package com.wagerengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Wager Engine.
 *
 * Wager Engine is a custodial ledger for a wagering economy: users convert a native
 * asset into a pegged balance, stake it against configured games, and convert winnings
 * back. Pegged-asset issuance and identity checks are delegated to external collaborators.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WagerEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(WagerEngineApplication.class, args);
    }
}
