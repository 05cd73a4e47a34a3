package com.qrwallet.controller;

import com.qrwallet.api.WalletApi;
import com.qrwallet.api.response.WalletLookupResponse;
import com.qrwallet.security.CallerContext;
import com.qrwallet.service.WalletLookupService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Wallets", description = "Wallet lookup by wallet id")
@Validated
@RequiredArgsConstructor
public class WalletController implements WalletApi {

    private final WalletLookupService walletLookupService;
    private final CallerContext callerContext;

    @Override
    public ResponseEntity<WalletLookupResponse> lookupWallet(String walletId) {
        return ResponseEntity.ok(walletLookupService.lookupWallet(callerContext.requireUserId(), walletId));
    }
}
