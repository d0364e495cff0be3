package com.flagship.stablecoin_engine.engine;

import com.flagship.stablecoin_engine.engine.dto.AccountResponse;
import com.flagship.stablecoin_engine.engine.dto.AmountResponse;
import com.flagship.stablecoin_engine.engine.dto.AssetResponse;
import com.flagship.stablecoin_engine.engine.dto.CollateralRequest;
import com.flagship.stablecoin_engine.engine.dto.DebtRequest;
import com.flagship.stablecoin_engine.engine.dto.LiquidationRequest;
import com.flagship.stablecoin_engine.engine.dto.LiquidationResponse;
import com.flagship.stablecoin_engine.engine.dto.OperationResponse;
import com.flagship.stablecoin_engine.engine.dto.ParametersResponse;
import com.flagship.stablecoin_engine.engine.dto.PositionRequest;
import com.flagship.stablecoin_engine.liquidation.LiquidationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.List;

/**
 * REST surface of the engine.
 *
 * The calling account of every mutating request is taken from the
 * X-Account-Address header. Amounts are raw 18-decimal integers, written as
 * strings in responses. Errors are rendered by the global exception handler.
 */
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Slf4j
public class EngineController {

    static final String ACCOUNT_HEADER = "X-Account-Address";

    private final StablecoinEngine engine;

    // ==================== Mutating Operations ====================

    @PostMapping("/collateral/deposit")
    public ResponseEntity<OperationResponse> depositCollateral(
            @Valid @RequestBody CollateralRequest request,
            @RequestHeader(ACCOUNT_HEADER) String account) {
        log.info("Received deposit request: asset={}, amount={}", request.getAssetId(), request.getAmount());
        engine.depositCollateral(account, request.getAssetId(), request.getAmount());
        return acknowledge("depositCollateral", account);
    }

    @PostMapping("/collateral/redeem")
    public ResponseEntity<OperationResponse> redeemCollateral(
            @Valid @RequestBody CollateralRequest request,
            @RequestHeader(ACCOUNT_HEADER) String account) {
        log.info("Received redeem request: asset={}, amount={}", request.getAssetId(), request.getAmount());
        engine.redeemCollateral(account, request.getAssetId(), request.getAmount());
        return acknowledge("redeemCollateral", account);
    }

    @PostMapping("/debt/mint")
    public ResponseEntity<OperationResponse> mintDebt(
            @Valid @RequestBody DebtRequest request,
            @RequestHeader(ACCOUNT_HEADER) String account) {
        log.info("Received mint request: amount={}", request.getAmount());
        engine.mintDebt(account, request.getAmount());
        return acknowledge("mintDebt", account);
    }

    @PostMapping("/debt/burn")
    public ResponseEntity<OperationResponse> burnDebt(
            @Valid @RequestBody DebtRequest request,
            @RequestHeader(ACCOUNT_HEADER) String account) {
        log.info("Received burn request: amount={}", request.getAmount());
        engine.burnDebt(account, request.getAmount());
        return acknowledge("burnDebt", account);
    }

    @PostMapping("/positions/open")
    public ResponseEntity<OperationResponse> openPosition(
            @Valid @RequestBody PositionRequest request,
            @RequestHeader(ACCOUNT_HEADER) String account) {
        log.info("Received open position request: asset={}, collateral={}, debt={}",
            request.getAssetId(), request.getCollateralAmount(), request.getDebtAmount());
        engine.depositCollateralAndMint(account, request.getAssetId(),
            request.getCollateralAmount(), request.getDebtAmount());
        return acknowledge("depositCollateralAndMint", account);
    }

    @PostMapping("/positions/close")
    public ResponseEntity<OperationResponse> closePosition(
            @Valid @RequestBody PositionRequest request,
            @RequestHeader(ACCOUNT_HEADER) String account) {
        log.info("Received close position request: asset={}, collateral={}, debt={}",
            request.getAssetId(), request.getCollateralAmount(), request.getDebtAmount());
        engine.redeemAndBurn(account, request.getAssetId(),
            request.getCollateralAmount(), request.getDebtAmount());
        return acknowledge("redeemAndBurn", account);
    }

    @PostMapping("/liquidations")
    public ResponseEntity<LiquidationResponse> liquidate(
            @Valid @RequestBody LiquidationRequest request,
            @RequestHeader(ACCOUNT_HEADER) String liquidator) {
        log.info("Received liquidation request: user={}, asset={}, debtToCover={}",
            request.getUser(), request.getAssetId(), request.getDebtToCover());
        LiquidationResult result = engine.liquidate(
            liquidator, request.getAssetId(), request.getUser(), request.getDebtToCover());
        return ResponseEntity.ok(LiquidationResponse.from(result));
    }

    // ==================== Queries ====================

    @GetMapping("/accounts/{address}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("address") String address) {
        return ResponseEntity.ok(AccountResponse.from(engine.getAccountInformation(address), engine.getLedgerVersion()));
    }

    @GetMapping("/accounts/{address}/collateral/{assetId}")
    public ResponseEntity<AmountResponse> getCollateralBalance(
            @PathVariable("address") String address,
            @PathVariable("assetId") String assetId) {
        return ResponseEntity.ok(new AmountResponse(assetId, engine.getCollateralBalanceOfUser(address, assetId)));
    }

    @GetMapping("/assets")
    public ResponseEntity<List<AssetResponse>> getAssets() {
        return ResponseEntity.ok(engine.getCollateralAssets().stream().map(AssetResponse::from).toList());
    }

    @GetMapping("/assets/{assetId}/usd-value")
    public ResponseEntity<AmountResponse> getUsdValue(
            @PathVariable("assetId") String assetId,
            @RequestParam("amount") BigInteger amount) {
        return ResponseEntity.ok(new AmountResponse(assetId, engine.getUsdValue(assetId, amount)));
    }

    @GetMapping("/assets/{assetId}/token-amount")
    public ResponseEntity<AmountResponse> getTokenAmount(
            @PathVariable("assetId") String assetId,
            @RequestParam("usdAmount") BigInteger usdAmount) {
        return ResponseEntity.ok(new AmountResponse(assetId, engine.getTokenAmountFromUsd(assetId, usdAmount)));
    }

    @GetMapping("/assets/{assetId}/liquidation-bonus")
    public ResponseEntity<AmountResponse> getLiquidationBonus(
            @PathVariable("assetId") String assetId,
            @RequestParam("debtToCover") BigInteger debtToCover) {
        return ResponseEntity.ok(new AmountResponse(assetId, engine.previewLiquidationBonus(assetId, debtToCover)));
    }

    @GetMapping("/parameters")
    public ResponseEntity<ParametersResponse> getParameters() {
        return ResponseEntity.ok(ParametersResponse.from(engine.getParameters()));
    }

    private ResponseEntity<OperationResponse> acknowledge(String operation, String account) {
        return ResponseEntity.ok(new OperationResponse(operation, account, engine.getLedgerVersion()));
    }
}
