package com.timemarket.api.funds;

import com.timemarket.core.ledger.InMemoryFundsCustody;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Balances held by the local ledger's custody. Deposits fund test accounts
 * of a development node; there is no withdrawal.
 */
@RestController
@RequestMapping("/api/v1/funds")
public class FundsController {

    private static final Logger log = LoggerFactory.getLogger(FundsController.class);

    private final InMemoryFundsCustody custody;

    public FundsController(InMemoryFundsCustody custody) {
        this.custody = custody;
    }

    @GetMapping("/{address}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String address) {
        return ResponseEntity.ok(new BalanceResponse(address, custody.balanceOf(address)));
    }

    @GetMapping("/contract")
    public ResponseEntity<BigInteger> getContractBalance() {
        return ResponseEntity.ok(custody.contractBalance());
    }

    @PostMapping("/{address}/deposit")
    public ResponseEntity<BalanceResponse> deposit(
            @PathVariable String address,
            @Valid @RequestBody DepositRequest request) {
        custody.deposit(address, request.amount());
        log.info("Deposited {} to {}", request.amount(), address);
        return ResponseEntity.ok(new BalanceResponse(address, custody.balanceOf(address)));
    }

    public record DepositRequest(@NotNull @Positive BigInteger amount) {}
    public record BalanceResponse(String address, BigInteger balance) {}
}
