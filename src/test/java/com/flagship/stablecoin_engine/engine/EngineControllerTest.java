package com.flagship.stablecoin_engine.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.stablecoin_engine.engine.dto.CollateralRequest;
import com.flagship.stablecoin_engine.engine.dto.DebtRequest;
import com.flagship.stablecoin_engine.engine.dto.LiquidationRequest;
import com.flagship.stablecoin_engine.engine.dto.PositionRequest;
import com.flagship.stablecoin_engine.simulation.dto.FundWalletRequest;
import com.flagship.stablecoin_engine.simulation.dto.PriceUpdateRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST API tests against the full application with simulated collaborators.
 *
 * These tests verify:
 * - Every mutating endpoint takes the caller from X-Account-Address
 * - Amounts travel as decimal strings
 * - Each engine error maps to its HTTP status and error code
 */
@SpringBootTest
@AutoConfigureMockMvc
class EngineControllerTest {

    private static final String ACCOUNT_HEADER = "X-Account-Address";
    private static final BigInteger ONE = BigInteger.TEN.pow(18);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String user;
    private String liquidator;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private static BigInteger units(long whole) {
        return BigInteger.valueOf(whole).multiply(ONE);
    }

    @BeforeEach
    void setUp() throws Exception {
        // Accounts are unique per test; the application context and its ledger are shared
        user = "0x" + UUID.randomUUID().toString().replace("-", "");
        liquidator = "0x" + UUID.randomUUID().toString().replace("-", "");
        setPrice("eth-usd", 2000);
        setPrice("btc-usd", 1000);
    }

    private void setPrice(String feedId, long dollars) throws Exception {
        PriceUpdateRequest request = PriceUpdateRequest.builder()
            .answer(BigInteger.valueOf(dollars).multiply(BigInteger.TEN.pow(8)))
            .build();
        mockMvc.perform(put("/api/oracle/feeds/" + feedId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk());
    }

    private void fund(String holder, String assetId, BigInteger amount) throws Exception {
        FundWalletRequest request = FundWalletRequest.builder().assetId(assetId).amount(amount).build();
        mockMvc.perform(post("/api/simulation/wallets/" + holder + "/collateral")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk());
    }

    private void openPosition(String account, BigInteger collateral, BigInteger debt) throws Exception {
        fund(account, "WETH", collateral);
        PositionRequest request = PositionRequest.builder()
            .assetId("WETH")
            .collateralAmount(collateral)
            .debtAmount(debt)
            .build();
        mockMvc.perform(post("/api/engine/positions/open")
                .header(ACCOUNT_HEADER, account)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.operation").value("depositCollateralAndMint"))
            .andExpect(jsonPath("$.account").value(account));
    }

    @Test
    @DisplayName("Open position and read the account back")
    void testOpenPositionAndAccountInfo() throws Exception {
        printTestHeader("Open Position");

        openPosition(user, units(10), units(5000));

        MvcResult result = mockMvc.perform(get("/api/engine/accounts/" + user))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_debt_minted").value("5000000000000000000000"))
            .andExpect(jsonPath("$.collateral_value_usd").value("20000000000000000000000"))
            .andExpect(jsonPath("$.health_factor").value("2000000000000000000"))
            .andExpect(jsonPath("$.max_mintable_usd").value("10000000000000000000000"))
            .andReturn();

        printOutput("Account", result.getResponse().getContentAsString());

        mockMvc.perform(get("/api/engine/accounts/" + user + "/collateral/WETH"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.value").value("10000000000000000000"));
    }

    @Test
    @DisplayName("Deposit then mint as separate calls")
    void testDepositAndMint() throws Exception {
        fund(user, "WBTC", units(4));

        mockMvc.perform(post("/api/engine/collateral/deposit")
                .header(ACCOUNT_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                    CollateralRequest.builder().assetId("WBTC").amount(units(4)).build())))
            .andExpect(status().isOk());

        mockMvc.perform(post("/api/engine/debt/mint")
                .header(ACCOUNT_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(DebtRequest.builder().amount(units(2000)).build())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.operation").value("mintDebt"));

        mockMvc.perform(get("/api/engine/accounts/" + user))
            .andExpect(jsonPath("$.health_factor").value("1000000000000000000"));
    }

    @Test
    @DisplayName("Minting beyond the limit is 422 with the computed health factor")
    void testMintBeyondLimit() throws Exception {
        printTestHeader("Mint Beyond Limit");

        openPosition(user, units(10), units(1000));
        printInput("Mint", "14000 more against $20000 collateral");

        mockMvc.perform(post("/api/engine/debt/mint")
                .header(ACCOUNT_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(DebtRequest.builder().amount(units(14000)).build())))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("BELOW_MINIMUM_HEALTH_FACTOR"))
            .andExpect(jsonPath("$.details.health_factor").value("666666666666666666"));
    }

    @Test
    @DisplayName("Mutating calls without the account header are rejected")
    void testMissingAccountHeader() throws Exception {
        mockMvc.perform(post("/api/engine/debt/burn")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(DebtRequest.builder().amount(units(1)).build())))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MISSING_HEADER"));
    }

    @Test
    @DisplayName("Unknown asset, zero amount and missing fields are client errors")
    void testClientErrors() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit")
                .header(ACCOUNT_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                    CollateralRequest.builder().assetId("DOGE").amount(units(1)).build())))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("ASSET_NOT_ALLOWED"));

        mockMvc.perform(post("/api/engine/collateral/redeem")
                .header(ACCOUNT_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                    CollateralRequest.builder().assetId("WETH").amount(BigInteger.ZERO).build())))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_AMOUNT"));

        mockMvc.perform(post("/api/engine/collateral/deposit")
                .header(ACCOUNT_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"asset_id\": \"WETH\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.details.amount").exists());

        mockMvc.perform(get("/api/engine/assets/WETH/usd-value").param("amount", "lots"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_PARAMETER"));
    }

    @Test
    @DisplayName("Deposit without wallet funds is 502 and leaves no balance")
    void testTransferFailed() throws Exception {
        mockMvc.perform(post("/api/engine/collateral/deposit")
                .header(ACCOUNT_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                    CollateralRequest.builder().assetId("WETH").amount(units(1)).build())))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.error").value("TRANSFER_FAILED"));

        mockMvc.perform(get("/api/engine/accounts/" + user + "/collateral/WETH"))
            .andExpect(jsonPath("$.value").value("0"));
    }

    @Test
    @DisplayName("Liquidate after a price drop over REST")
    void testLiquidation() throws Exception {
        printTestHeader("Liquidation Over REST");

        openPosition(user, units(10), units(10000));
        openPosition(liquidator, units(20), units(10000));

        LiquidationRequest request = LiquidationRequest.builder()
            .assetId("WETH")
            .user(user)
            .debtToCover(units(10000))
            .build();

        mockMvc.perform(post("/api/engine/liquidations")
                .header(ACCOUNT_HEADER, liquidator)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("NOT_LIQUIDATABLE"));

        setPrice("eth-usd", 1800);

        MvcResult result = mockMvc.perform(post("/api/engine/liquidations")
                .header(ACCOUNT_HEADER, liquidator)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_collateral_seized").value("6111111111111111110"))
            .andExpect(jsonPath("$.starting_health_factor").value("900000000000000000"))
            .andReturn();

        printOutput("Liquidation", result.getResponse().getContentAsString());

        mockMvc.perform(get("/api/engine/accounts/" + user + "/collateral/WETH"))
            .andExpect(jsonPath("$.value").value("3888888888888888890"));
    }

    @Test
    @DisplayName("Close position returns collateral and clears debt")
    void testClosePosition() throws Exception {
        openPosition(user, units(10), units(3000));

        PositionRequest request = PositionRequest.builder()
            .assetId("WETH")
            .collateralAmount(units(10))
            .debtAmount(units(3000))
            .build();
        mockMvc.perform(post("/api/engine/positions/close")
                .header(ACCOUNT_HEADER, user)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/simulation/wallets/" + user + "/collateral/WETH"))
            .andExpect(jsonPath("$.balance").value("10000000000000000000"));
        mockMvc.perform(get("/api/engine/accounts/" + user))
            .andExpect(jsonPath("$.total_debt_minted").value("0"));
    }

    @Test
    @DisplayName("Asset, conversion and parameter queries")
    void testQueries() throws Exception {
        mockMvc.perform(get("/api/engine/assets"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[0].asset_id").value("WETH"))
            .andExpect(jsonPath("$[0].price_feed_id").value("eth-usd"));

        mockMvc.perform(get("/api/engine/assets/WETH/usd-value").param("amount", units(15).toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.value").value("30000000000000000000000"));

        mockMvc.perform(get("/api/engine/assets/WETH/token-amount").param("usdAmount", units(100).toString()))
            .andExpect(jsonPath("$.value").value("50000000000000000"));

        mockMvc.perform(get("/api/engine/assets/WETH/liquidation-bonus").param("debtToCover", units(10000).toString()))
            .andExpect(jsonPath("$.value").value("500000000000000000"));

        mockMvc.perform(get("/api/engine/parameters"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.liquidation_threshold").value("50"))
            .andExpect(jsonPath("$.liquidation_bonus").value("10"))
            .andExpect(jsonPath("$.min_health_factor").value("1000000000000000000"))
            .andExpect(jsonPath("$.oracle_timeout_seconds").value(10800));
    }

    @Test
    @DisplayName("Liveness endpoint reports fresh feeds")
    void testHealthEndpoint() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.priceFeeds['eth-usd']").value("UP"));
    }

    @Test
    @DisplayName("A backdated feed answer makes prices stale until the next update")
    void testBackdatedFeedIsStale() throws Exception {
        printTestHeader("Backdated Feed");

        PriceUpdateRequest request = PriceUpdateRequest.builder()
            .answer(BigInteger.valueOf(2000).multiply(BigInteger.TEN.pow(8)))
            .updatedAt(Instant.now().minus(Duration.ofHours(4)))
            .build();
        printInput("Feed update", request);
        mockMvc.perform(put("/api/oracle/feeds/eth-usd")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk());

        mockMvc.perform(get("/api/engine/assets/WETH/usd-value").param("amount", units(1).toString()))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("STALE_PRICE"));
        mockMvc.perform(get("/health"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.priceFeeds['eth-usd']").value("STALE"));

        setPrice("eth-usd", 2000);

        mockMvc.perform(get("/api/engine/assets/WETH/usd-value").param("amount", units(1).toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.value").value("2000000000000000000000"));
    }

    @Test
    @DisplayName("Debt token supply follows minting")
    void testDebtTokenSupply() throws Exception {
        openPosition(user, units(10), units(1000));

        MvcResult result = mockMvc.perform(get("/api/simulation/debt-token/supply"))
            .andExpect(status().isOk())
            .andReturn();
        BigInteger supply = new BigInteger(objectMapper.readTree(result.getResponse().getContentAsString())
            .get("total_supply").asText());

        printOutput("Total supply", supply);
        assertTrue(supply.compareTo(units(1000)) >= 0);
    }
}
