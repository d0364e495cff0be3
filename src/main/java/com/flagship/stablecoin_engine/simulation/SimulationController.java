package com.flagship.stablecoin_engine.simulation;

import com.flagship.stablecoin_engine.asset.AssetRegistry;
import com.flagship.stablecoin_engine.oracle.PriceRound;
import com.flagship.stablecoin_engine.simulation.dto.FundWalletRequest;
import com.flagship.stablecoin_engine.simulation.dto.PriceRoundResponse;
import com.flagship.stablecoin_engine.simulation.dto.PriceUpdateRequest;
import com.flagship.stablecoin_engine.simulation.dto.TokenSupplyResponse;
import com.flagship.stablecoin_engine.simulation.dto.WalletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Optional;

/**
 * Drives the in-memory collaborators for local runs.
 *
 * Every endpoint answers 404 when the corresponding capability is backed by
 * a real implementation instead of the simulated one.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class SimulationController {

    private final AssetRegistry registry;
    private final Optional<SimulatedPriceOracle> oracle;
    private final Optional<InMemoryCollateralCustody> custody;
    private final Optional<InMemoryDebtToken> debtToken;

    @PutMapping("/api/oracle/feeds/{feedId}")
    public ResponseEntity<PriceRoundResponse> updateAnswer(
            @PathVariable("feedId") String feedId,
            @Valid @RequestBody PriceUpdateRequest request) {
        Instant updatedAt = request.getUpdatedAt();
        return oracle
            .map(o -> updatedAt == null
                ? o.updateAnswer(feedId, request.getAnswer())
                : o.updateAnswer(feedId, request.getAnswer(), updatedAt))
            .map(round -> ResponseEntity.ok(PriceRoundResponse.from(feedId, round)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/api/oracle/feeds/{feedId}")
    public ResponseEntity<PriceRoundResponse> latestRound(@PathVariable("feedId") String feedId) {
        Optional<PriceRound> round = oracle.flatMap(o -> o.latestRoundData(feedId));
        return round
            .map(r -> ResponseEntity.ok(PriceRoundResponse.from(feedId, r)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/api/simulation/wallets/{holder}/collateral")
    public ResponseEntity<WalletResponse> fundWallet(
            @PathVariable("holder") String holder,
            @Valid @RequestBody FundWalletRequest request) {
        if (custody.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        registry.require(request.getAssetId());
        InMemoryCollateralCustody wallets = custody.get();
        wallets.fund(request.getAssetId(), holder, request.getAmount());
        log.info("Funded wallet: holder={}, asset={}, amount={}", holder, request.getAssetId(), request.getAmount());
        return ResponseEntity.ok(new WalletResponse(holder, request.getAssetId(),
            wallets.balanceOf(request.getAssetId(), holder)));
    }

    @GetMapping("/api/simulation/wallets/{holder}/collateral/{assetId}")
    public ResponseEntity<WalletResponse> walletBalance(
            @PathVariable("holder") String holder,
            @PathVariable("assetId") String assetId) {
        registry.require(assetId);
        return custody
            .map(c -> ResponseEntity.ok(new WalletResponse(holder, assetId, c.balanceOf(assetId, holder))))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/api/simulation/debt-token/supply")
    public ResponseEntity<TokenSupplyResponse> debtTokenSupply() {
        return debtToken
            .map(t -> ResponseEntity.ok(new TokenSupplyResponse(t.totalSupply())))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/api/simulation/wallets/{holder}/debt-token")
    public ResponseEntity<WalletResponse> debtTokenBalance(@PathVariable("holder") String holder) {
        return debtToken
            .map(t -> ResponseEntity.ok(new WalletResponse(holder, null, t.balanceOf(holder))))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
