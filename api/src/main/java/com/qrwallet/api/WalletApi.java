package com.qrwallet.api;

import com.qrwallet.api.response.WalletLookupResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Wallet discovery API.
 *
 * <p>Lookups are rate limited per user and per client address; repeated misses from one address
 * trigger a cool-down to slow down wallet ID enumeration.
 */
@RequestMapping("/api/v1/wallets")
public interface WalletApi {

    /**
     * Resolves a public wallet ID to the owner's display information.
     *
     * @param walletId Public wallet ID
     * @return {@code found=false} when no wallet matches
     */
    @GetMapping("/lookup/{walletId}")
    ResponseEntity<WalletLookupResponse> lookupWallet(@PathVariable("walletId") String walletId);
}
