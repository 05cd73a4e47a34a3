package com.qrwallet.api;

import com.qrwallet.api.request.FinalizeTransferRequest;
import com.qrwallet.api.request.WithdrawalRequest;
import com.qrwallet.api.response.FinalizeTransferResponse;
import com.qrwallet.api.response.WithdrawalResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Withdrawal API (wallet to bank account or mobile money through the card/bank gateway).
 */
@RequestMapping("/api/v1/withdrawals")
public interface WithdrawalApi {

    /**
     * Initiates a payout. The wallet is debited before the gateway transfer is requested and
     * credited back if the gateway rejects the transfer.
     */
    @PostMapping
    ResponseEntity<WithdrawalResponse> initiateWithdrawal(@RequestBody @Valid WithdrawalRequest request);

    /**
     * Completes a payout that the gateway put on hold pending OTP confirmation.
     */
    @PostMapping("/finalize")
    ResponseEntity<FinalizeTransferResponse> finalizeTransfer(@RequestBody @Valid FinalizeTransferRequest request);
}
