/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos;

import com.sanalpos.domain.model.BankCode;
import com.sanalpos.domain.model.CurrencyCode;
import com.sanalpos.domain.model.MdStatus;
import com.sanalpos.domain.model.OperationType;
import com.sanalpos.infrastructure.crypto.Cards;
import com.sanalpos.infrastructure.pos.signature.AmountFormat;
import com.sanalpos.infrastructure.pos.signature.SignatureEngine;
import com.sanalpos.infrastructure.pos.signature.SignatureInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.YearMonth;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Validation, transport and callback verification shared by the bank adapters. Subclasses supply
 * the wire format, the signature engine and the callback field mapping.
 */
public abstract class AbstractVirtualPosAdapter implements VirtualPosAdapter {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final BankAdapterConfig config;
    protected final SignatureEngine signatureEngine;
    private final WebClient webClient;
    private final Duration timeout;
    private final Clock clock;

    protected AbstractVirtualPosAdapter(BankAdapterConfig config, SignatureEngine signatureEngine,
                                        WebClient webClient, Duration timeout, Clock clock) {
        this.config = config;
        this.signatureEngine = signatureEngine;
        this.webClient = webClient;
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public BankCode bank() {
        return config.bank();
    }

    public BankAdapterConfig config() {
        return config;
    }

    @Override
    public final boolean verifyCallback(CallbackData data) {
        if (data == null) {
            log.warn("{} 3D callback rejected: no callback data", bank());
            return false;
        }
        try {
            List<String> missing = requiredCallbackFields().stream().filter(name -> !data.has(name)).toList();
            if (!missing.isEmpty()) {
                log.warn("{} 3D callback rejected: missing fields {}", bank(), missing);
                return false;
            }

            CallbackCheck check = readCallback(data);
            String expected = signatureEngine.computeSignature(OperationType.CALLBACK, check.signatureInput());
            if (!signatureEngine.matches(expected, check.suppliedSignature())) {
                log.error("{} 3D callback signature mismatch orderId={}: possible tampering attempt",
                        bank(), check.orderId());
                return false;
            }

            MdStatus mdStatus = MdStatus.of(check.mdStatus());
            if (!mdStatus.isFullyAuthenticated()) {
                log.warn("{} 3D callback rejected orderId={}: authentication incomplete mdStatus={} ({})",
                        bank(), check.orderId(), check.mdStatus(), mdStatus);
                return false;
            }
            if (!check.transactionApproved()) {
                log.info("{} 3D callback rejected orderId={}: transaction not approved", bank(), check.orderId());
                return false;
            }

            log.info("{} 3D callback verified orderId={}", bank(), check.orderId());
            return true;
        } catch (RuntimeException e) {
            log.error("{} 3D callback verification failed", bank(), e);
            return false;
        }
    }

    /**
     * Callback fields that must be present before the signature is even recomputed.
     */
    protected abstract List<String> requiredCallbackFields();

    protected abstract CallbackCheck readCallback(CallbackData data);

    /**
     * Reads the bank's wire response. Also applied to the body of a 4xx reply, which banks use for
     * rejections that still carry their own code.
     */
    protected abstract BankReply parseReply(String body);

    /**
     * Validates a payment before anything is signed or sent and returns its currency.
     *
     * @param cardRequired false for hosted 3D pages where the card is entered at the bank
     */
    protected CurrencyCode validatePayment(PaymentRequest request, boolean cardRequired) {
        if (request == null) {
            throw VirtualPosException.validation(bank(), "Payment request is required");
        }
        if (isBlank(request.orderId())) {
            throw VirtualPosException.validation(bank(), "orderId is required");
        }
        if (request.amount() == null || request.amount().signum() <= 0) {
            throw VirtualPosException.validation(bank(), "amount must be greater than zero");
        }
        if (hasSubunitFraction(request.amount())) {
            throw VirtualPosException.validation(bank(), "amount must not have more than 2 decimal places");
        }
        if (request.installmentCount() < 1) {
            throw VirtualPosException.validation(bank(), "installmentCount must be at least 1");
        }
        CurrencyCode currency = currency(request.currency());
        if (cardRequired) {
            if (!Cards.isValidCardNumber(request.cardNumber())) {
                throw VirtualPosException.validation(bank(), "Invalid card number");
            }
            if (!Cards.isExpiryValid(request.cardExpireMonth(), request.cardExpireYear(), YearMonth.now(clock))) {
                throw VirtualPosException.validation(bank(), "Invalid expire date");
            }
            if (request.cardCvv() == null || !request.cardCvv().trim().matches("\\d{3,4}")) {
                throw VirtualPosException.validation(bank(), "Invalid CVV");
            }
        }
        return currency;
    }

    protected void validateRefund(RefundRequest request) {
        if (request == null) {
            throw VirtualPosException.validation(bank(), "Refund request is required");
        }
        requireReference(request.transactionId(), request.orderId());
        if (request.amount() != null && request.amount().signum() <= 0) {
            throw VirtualPosException.validation(bank(), "refund amount must be greater than zero");
        }
        if (request.amount() != null && hasSubunitFraction(request.amount())) {
            throw VirtualPosException.validation(bank(), "refund amount must not have more than 2 decimal places");
        }
        if (request.currency() != null) {
            currency(request.currency());
        }
    }

    protected void validateCancel(CancelRequest request) {
        if (request == null) {
            throw VirtualPosException.validation(bank(), "Cancel request is required");
        }
        requireReference(request.transactionId(), request.orderId());
    }

    protected CurrencyCode currency(String isoCode) {
        return CurrencyCode.find(isoCode)
                .orElseThrow(() -> VirtualPosException.validation(bank(), "Unsupported currency: " + isoCode));
    }

    protected String successUrl(PaymentRequest request) {
        return redirectUrl(request.successUrl(), "/payment/3d/success", "successUrl");
    }

    protected String failUrl(PaymentRequest request) {
        return redirectUrl(request.failUrl(), "/payment/3d/fail", "failUrl");
    }

    /**
     * Sends one request and returns the raw body. A 4xx reply whose body carries a bank response
     * code is returned like any other answer. Other transport failures surface as
     * {@link VirtualPosException}s whose outcome is indeterminate: the bank may have processed
     * the request even though no answer arrived.
     */
    protected String post(String operation, String url, MediaType contentType,
                          BodyInserter<?, ? super ClientHttpRequest> body) {
        try {
            String response = webClient.post()
                    .uri(url)
                    .contentType(contentType)
                    .body(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return response == null ? "" : response;
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            String rejection = e.getResponseBodyAsString();
            if (!e.getStatusCode().is5xxServerError() && !isBlank(rejection)
                    && !BankReply.MISSING_RESPONSE_CODE.equals(parseReply(rejection).code())) {
                log.info("{} {} rejected with HTTP {}", bank(), operation, status);
                return rejection;
            }
            log.warn("{} {} failed type={} status={}", bank(), operation, VirtualPosErrorType.HTTP_ERROR, status);
            throw transportError(VirtualPosErrorType.HTTP_ERROR, operation + " request failed with HTTP " + status, status, e);
        } catch (WebClientRequestException e) {
            log.error("{} {} failed type={}: outcome unknown", bank(), operation, VirtualPosErrorType.CONNECTION, e);
            throw transportError(VirtualPosErrorType.CONNECTION, operation + " request could not be completed", null, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                log.error("{} {} timed out after {}: outcome unknown", bank(), operation, timeout);
                throw transportError(VirtualPosErrorType.TIMEOUT, operation + " request timed out", null, e);
            }
            log.error("{} {} failed type={}: outcome unknown", bank(), operation, VirtualPosErrorType.UNKNOWN, e);
            throw transportError(VirtualPosErrorType.UNKNOWN, operation + " request failed", null, e);
        }
    }

    protected void logDecision(String operation, String orderId, BankReply reply) {
        if (reply.approved()) {
            log.info("{} {} approved orderId={} transactionId={}", bank(), operation, orderId, reply.transactionId());
        } else {
            log.info("{} {} declined orderId={} code={} message={}", bank(), operation, orderId, reply.code(), reply.message());
        }
    }

    protected void logRequest(String operation, PaymentRequest request) {
        if (log.isDebugEnabled()) {
            log.debug("{} {} request {}", bank(), operation, request);
        }
    }

    protected static String installmentOrEmpty(int installmentCount) {
        return installmentCount > 1 ? Integer.toString(installmentCount) : "";
    }

    protected static String formatOrEmpty(BigDecimal amount, AmountFormat format) {
        return amount == null ? "" : format.format(amount);
    }

    private static boolean hasSubunitFraction(BigDecimal amount) {
        return amount.stripTrailingZeros().scale() > 2;
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void requireReference(String transactionId, String orderId) {
        if (isBlank(transactionId)) {
            throw VirtualPosException.validation(bank(), "transactionId of the original payment is required");
        }
        if (isBlank(orderId)) {
            throw VirtualPosException.validation(bank(), "orderId of the original payment is required");
        }
    }

    private String redirectUrl(String explicit, String defaultPath, String name) {
        if (!isBlank(explicit)) return explicit;
        if (!isBlank(config.callbackBaseUrl())) return config.callbackBaseUrl() + defaultPath;
        throw VirtualPosException.validation(bank(), name + " is required for 3D Secure payments");
    }

    private VirtualPosException transportError(VirtualPosErrorType type, String message, Integer status, Throwable cause) {
        return new VirtualPosException(bank(), type, message, status, cause);
    }

    /**
     * What an adapter extracted from a callback: the hash input, the bank's signature and the
     * status fields checked after the signature matches.
     */
    public record CallbackCheck(
            String orderId,
            SignatureInput signatureInput,
            String suppliedSignature,
            String mdStatus,
            boolean transactionApproved
    ) {}
}
