package com.qrwallet.api;

import com.qrwallet.api.request.SendMoneyRequest;
import com.qrwallet.api.response.SendMoneyResponse;
import com.qrwallet.api.response.TransactionReceiptResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Optional;

/**
 * WebClient-based implementation of TransferApi for consuming the wallet transfer service.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * register it as a bean themselves, with a WebClient that forwards the caller identity
 * in the {@code X-User-Id} header.
 *
 * <p>Configuration example:
 * <pre>
 * {@code
 * @Bean
 * public TransferClient transferClient(WebClient.Builder builder,
 *                                      @Value("${services.qrwallet.url}") String baseUrl) {
 *     return new TransferClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class TransferClient implements TransferApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<SendMoneyResponse> sendMoney(SendMoneyRequest request) {
        log.debug("Calling sendMoney: recipientWalletId={}, amount={}",
                request.recipientWalletId(), request.amount());

        return webClient.post()
                .uri("/api/v1/transfers")
                .bodyValue(request)
                .retrieve()
                .toEntity(SendMoneyResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<TransactionReceiptResponse>> listTransactions(Integer limit) {
        log.debug("Calling listTransactions: limit={}", limit);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/v1/transactions")
                        .queryParamIfPresent("limit", Optional.ofNullable(limit))
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<TransactionReceiptResponse>>() {})
                .block();
    }
}
