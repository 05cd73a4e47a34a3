package com.qrwallet.tests;

import com.qrwallet.TestBase;
import com.qrwallet.api.model.ErrorCode;
import com.qrwallet.api.request.SendMoneyRequest;
import com.qrwallet.error.WalletException;
import com.qrwallet.model.Wallet;
import com.qrwallet.service.TransferService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Concurrent transfers against a real PostgreSQL, where row locks behave as in production.
 *
 * <p>Tests verify:
 * <ul>
 *   <li>CON-001: Parallel debits of one wallet never overdraw it</li>
 *   <li>CON-002: Opposite transfers between two wallets do not deadlock</li>
 * </ul>
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("8. Concurrency Tests")
public class ConcurrentTransferTest extends TestBase {

    private static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");

    @Container
    private static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DOCKER_IMAGE);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private TransferService transferService;

    private static SendMoneyRequest transfer(Wallet recipient, String amount) {
        return new SendMoneyRequest(recipient.getWalletId(), new BigDecimal(amount), null, newIdempotencyKey());
    }

    private static <T> List<Future<T>> runTogether(List<Callable<T>> tasks) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(60, TimeUnit.SECONDS)).isTrue();
            return futures;
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("CON-001: Parallel transfers from one wallet")
    void parallelTransfers_NeverOverdraw() throws Exception {
        String sender = newUserId();
        createVerifiedWallet(sender, "Akua Donkor", "GHS", "1000.00");
        String receiver = newUserId();
        Wallet recipient = createVerifiedWallet(receiver, "Nana Ama", "GHS", null);

        // 200 + fee 10 each: only four fit into 1000
        List<Callable<ErrorCode>> tasks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            tasks.add(() -> {
                try {
                    transferService.sendMoney(sender, transfer(recipient, "200"));
                    return null;
                } catch (WalletException e) {
                    return e.getCode();
                }
            });
        }

        int succeeded = 0;
        for (Future<ErrorCode> future : runTogether(tasks)) {
            ErrorCode error = future.get();
            if (error == null) {
                succeeded++;
            } else {
                assertThat(error).isEqualTo(ErrorCode.WALLET_INSUFFICIENT_FUNDS);
            }
        }

        assertThat(succeeded).isEqualTo(4);
        assertThat(balanceOf(sender)).isEqualByComparingTo("160");
        assertThat(balanceOf(receiver)).isEqualByComparingTo("800");
    }

    @Test
    @DisplayName("CON-002: Opposite transfers between two wallets")
    void oppositeTransfers_AllComplete() throws Exception {
        String first = newUserId();
        Wallet firstWallet = createVerifiedWallet(first, "Akua Donkor", "GHS", "1000.00");
        String second = newUserId();
        Wallet secondWallet = createVerifiedWallet(second, "Nana Ama", "GHS", "1000.00");

        List<Callable<String>> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            tasks.add(() -> transferService.sendMoney(first, transfer(secondWallet, "100")).transactionId());
            tasks.add(() -> transferService.sendMoney(second, transfer(firstWallet, "100")).transactionId());
        }

        for (Future<String> future : runTogether(tasks)) {
            try {
                assertThat(future.get()).isNotBlank();
            } catch (ExecutionException e) {
                throw new AssertionError("Transfer failed", e.getCause());
            }
        }

        // each side paid 5 fees of 10
        assertThat(balanceOf(first)).isEqualByComparingTo("950");
        assertThat(balanceOf(second)).isEqualByComparingTo("950");
    }
}
