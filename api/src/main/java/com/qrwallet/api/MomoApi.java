package com.qrwallet.api;

import com.qrwallet.api.request.MomoPaymentRequest;
import com.qrwallet.api.response.MomoBalanceResponse;
import com.qrwallet.api.response.MomoTransactionResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Mobile-money API: collections (add money) and disbursements (withdraw).
 */
@RequestMapping("/api/v1/momo")
public interface MomoApi {

    /**
     * Asks the payer to approve a payment on their phone. The wallet is credited once the
     * collection is confirmed by webhook or status check.
     */
    @PostMapping("/collections")
    ResponseEntity<MomoTransactionResponse> requestToPay(@RequestBody @Valid MomoPaymentRequest request);

    /**
     * Pays out from the caller's wallet to a mobile-money number.
     */
    @PostMapping("/disbursements")
    ResponseEntity<MomoTransactionResponse> transfer(@RequestBody @Valid MomoPaymentRequest request);

    /**
     * Queries the provider for the status of one of the caller's transactions and applies it.
     */
    @GetMapping("/transactions/{referenceId}")
    ResponseEntity<MomoTransactionResponse> checkStatus(@PathVariable("referenceId") String referenceId);

    /**
     * Returns the platform's provider account balance for a product.
     *
     * @param product {@code collection} (default) or {@code disbursement}
     */
    @GetMapping("/balance")
    ResponseEntity<MomoBalanceResponse> getBalance(@RequestParam(value = "product", required = false) String product);
}
