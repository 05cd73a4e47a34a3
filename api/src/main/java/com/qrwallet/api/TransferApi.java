package com.qrwallet.api;

import com.qrwallet.api.request.SendMoneyRequest;
import com.qrwallet.api.response.SendMoneyResponse;
import com.qrwallet.api.response.TransactionReceiptResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Peer-to-peer transfer API.
 *
 * <p>The caller is identified by the authenticated principal; a transfer always debits the
 * caller's own wallet.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>TransferController - in service module (server-side implementation)</li>
 *   <li>TransferClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
public interface TransferApi {

    /**
     * Sends money to another wallet.
     *
     * <p>Fee is 1% of the amount, clamped to [10, 100], in the sender's currency and is charged on top
     * of the amount. Repeating the request with the same idempotency key returns the original result.
     *
     * @param request Recipient wallet ID, amount, optional note and idempotency key
     * @return Transfer result with the shared transaction ID and the sender's new balance
     */
    @PostMapping("/api/v1/transfers")
    ResponseEntity<SendMoneyResponse> sendMoney(@RequestBody @Valid SendMoneyRequest request);

    /**
     * Lists the caller's receipts, newest first.
     *
     * @param limit Maximum number of receipts (default 50, capped at 200)
     */
    @GetMapping("/api/v1/transactions")
    ResponseEntity<List<TransactionReceiptResponse>> listTransactions(
            @RequestParam(value = "limit", required = false) Integer limit);
}
