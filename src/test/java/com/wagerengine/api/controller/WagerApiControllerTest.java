package com.wagerengine.api.controller;

import com.wagerengine.EngineTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP tests for the REST controllers and error mapping.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class WagerApiControllerTest extends EngineTestSupport {

    private static final String CALLER = "X-Caller-Id";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testDepositAndPlayOverHttp() throws Exception {
        mockMvc.perform(post("/api/v1/accounts/alice/deposit")
                .header(CALLER, ALICE)
                .param("nativeAmount", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.peggedAmount").value(200))
            .andExpect(jsonPath("$.balance").value(200));

        mockMvc.perform(post("/api/v1/games/coin-flip/play")
                .header(CALLER, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"betAmount\": 100, \"won\": false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fee").value(2))
            .andExpect(jsonPath("$.balance").value(100));

        mockMvc.perform(get("/api/v1/accounts/alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(100));
    }

    @Test
    void testDepositForAnotherIdentityForbidden() throws Exception {
        mockMvc.perform(post("/api/v1/accounts/alice/deposit")
                .header(CALLER, BOB)
                .param("nativeAmount", "1"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.category").value("AUTHORIZATION"));

        assertEquals(0, wagerEngine.balanceOf(ALICE));
    }

    @Test
    void testNonMultipleWithdrawalIsBadRequest() throws Exception {
        wagerEngine.deposit(ALICE, 2);

        mockMvc.perform(post("/api/v1/accounts/alice/withdraw")
                .header(CALLER, ALICE)
                .param("peggedAmount", "150"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.category").value("PRECONDITION"));

        assertEquals(200, wagerEngine.balanceOf(ALICE));
    }

    @Test
    void testInsolventPayoutIsConflict() throws Exception {
        wagerEngine.deposit(ALICE, 1);

        mockMvc.perform(post("/api/v1/games/coin-flip/play")
                .header(CALLER, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"betAmount\": 100, \"won\": true}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.category").value("SOLVENCY"));
    }

    @Test
    void testInvalidPlayRequestRejected() throws Exception {
        mockMvc.perform(post("/api/v1/games/coin-flip/play")
                .header(CALLER, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"betAmount\": -5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.won").exists());
    }

    @Test
    void testUnknownGameNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/games/poker"))
            .andExpect(status().isNotFound());
    }

    @Test
    void testAdminOperationsRequireOwner() throws Exception {
        mockMvc.perform(post("/api/v1/admin/pause").header(CALLER, BOB))
            .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/v1/admin/pause").header(CALLER, OWNER))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/accounts/alice/deposit")
                .header(CALLER, ALICE)
                .param("nativeAmount", "1"))
            .andExpect(status().isServiceUnavailable());

        mockMvc.perform(put("/api/v1/admin/games/dice")
                .header(CALLER, OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"minBet\": 1, \"maxBet\": 50, \"payoutMultiplierBps\": 60000,"
                    + " \"active\": true, \"displayName\": \"Dice\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.payoutMultiplierBps").value(60000));
    }

    @Test
    void testStatsAndConstants() throws Exception {
        mockMvc.perform(get("/api/v1/stats/constants"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.HOUSE_EDGE_BPS").value(250))
            .andExpect(jsonPath("$.RATIO").value(100));

        mockMvc.perform(get("/api/v1/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalGamesPlayed").value(0));
    }

    @Test
    void testMissingCallerHeaderUnauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/admin/pause"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void testGameConfigWithoutActiveFlagRejected() throws Exception {
        mockMvc.perform(put("/api/v1/admin/games/dice")
                .header(CALLER, OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"minBet\": 1, \"maxBet\": 50, \"payoutMultiplierBps\": 60000,"
                    + " \"displayName\": \"Dice\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.active").exists());

        assertTrue(wagerEngine.getGameConfig("dice").isActive());
        assertEquals(100, wagerEngine.getGameConfig("dice").getMinBet());
    }
}
