package com.timemarket.api.admin;

import com.timemarket.api.TransactionResponse;
import com.timemarket.blockchain.service.BlockchainMarketplaceService;
import com.timemarket.core.domain.ContractStats;
import com.timemarket.core.ledger.OfferLedger;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Platform administration REST API. Mutations are restricted to the owner.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final String CALLER = "X-Caller-Address";

    private final OfferLedger ledger;
    private final BlockchainMarketplaceService blockchainService;

    public AdminController(OfferLedger ledger, BlockchainMarketplaceService blockchainService) {
        this.ledger = ledger;
        this.blockchainService = blockchainService;
    }

    @GetMapping("/stats")
    public ResponseEntity<ContractStats> getContractStats() {
        return ResponseEntity.ok(ledger.getContractStats());
    }

    /**
     * Statistics of the deployed contract; 404 when the blockchain integration
     * is disabled or the node cannot be read.
     * GET /api/v1/admin/chain-stats
     */
    @GetMapping("/chain-stats")
    public ResponseEntity<ContractStats> getChainStats() {
        return blockchainService.getContractStats()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/settings")
    public ResponseEntity<SettingsResponse> getSettings() {
        return ResponseEntity.ok(new SettingsResponse(
                ledger.getContractAddress(),
                ledger.getOwner(),
                ledger.getTreasury(),
                ledger.getPlatformFee(),
                blockchainService.isEnabled()));
    }

    @PutMapping("/fee")
    public ResponseEntity<TransactionResponse> updatePlatformFee(
            @RequestHeader(CALLER) String caller,
            @RequestBody FeeRequest request) {
        return ResponseEntity.ok(TransactionResponse.from(ledger.updatePlatformFee(caller, request.feeBps())));
    }

    @PutMapping("/treasury")
    public ResponseEntity<TransactionResponse> updateTreasury(
            @RequestHeader(CALLER) String caller,
            @Valid @RequestBody TreasuryRequest request) {
        return ResponseEntity.ok(TransactionResponse.from(ledger.updateTreasury(caller, request.treasury())));
    }

    @PutMapping("/owner")
    public ResponseEntity<TransactionResponse> transferOwnership(
            @RequestHeader(CALLER) String caller,
            @Valid @RequestBody OwnerRequest request) {
        return ResponseEntity.ok(TransactionResponse.from(ledger.transferOwnership(caller, request.owner())));
    }

    /**
     * Sweep the contract balance to the owner.
     * POST /api/v1/admin/emergency-withdraw
     */
    @PostMapping("/emergency-withdraw")
    public ResponseEntity<TransactionResponse> emergencyWithdraw(@RequestHeader(CALLER) String caller) {
        return ResponseEntity.ok(TransactionResponse.from(ledger.emergencyWithdraw(caller)));
    }

    // DTOs
    public record SettingsResponse(
        String contractAddress,
        String owner,
        String treasury,
        int platformFeeBps,
        boolean blockchainEnabled
    ) {}

    public record FeeRequest(int feeBps) {}
    public record TreasuryRequest(@NotBlank String treasury) {}
    public record OwnerRequest(@NotBlank String owner) {}
}
