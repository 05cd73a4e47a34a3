package com.qrwallet.api;

import com.qrwallet.api.response.WalletLookupResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient-based implementation of WalletApi.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component; see {@link TransferClient}
 * for a registration example.
 */
@RequiredArgsConstructor
@Slf4j
public class WalletClient implements WalletApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<WalletLookupResponse> lookupWallet(String walletId) {
        log.debug("Calling lookupWallet: walletId={}", walletId);

        return webClient.get()
                .uri("/api/v1/wallets/lookup/{walletId}", walletId)
                .retrieve()
                .toEntity(WalletLookupResponse.class)
                .block();
    }
}
