package com.qrwallet.error;

import com.qrwallet.api.model.ErrorCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Application error carrying a machine-readable {@link ErrorCode}.
 *
 * <p>The message is safe to show to end users. {@link #getDetails()} holds structured context
 * (ids, limits, offending states) and must never contain secrets.
 */
@Getter
public class WalletException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;

    public WalletException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message != null ? message : code.defaultMessage(), cause);
        this.code = code;
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(details);
    }

    public static WalletException of(ErrorCode code) {
        return new WalletException(code, null, null, null);
    }

    public static WalletException of(ErrorCode code, String message) {
        return new WalletException(code, message, null, null);
    }

    public static WalletException of(ErrorCode code, String message, Map<String, Object> details) {
        return new WalletException(code, message, details, null);
    }

    /**
     * Wraps a failure of an external gateway call. The result is always retryable.
     *
     * @param code    {@code SERVICE_PAYSTACK_ERROR}, {@code SERVICE_MOMO_ERROR} or {@code SERVICE_UNAVAILABLE}
     * @param cause   Original failure, kept for logs only
     * @param context Non-secret context such as the operation and reference
     */
    public static WalletException service(ErrorCode code, Throwable cause, Map<String, Object> context) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (context != null) {
            details.putAll(context);
        }
        details.put("retryable", true);
        return new WalletException(code, null, details, cause);
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
