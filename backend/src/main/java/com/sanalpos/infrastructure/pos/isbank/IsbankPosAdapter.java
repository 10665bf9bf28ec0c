/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.isbank;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sanalpos.domain.model.CurrencyCode;
import com.sanalpos.domain.model.OperationType;
import com.sanalpos.infrastructure.crypto.Cards;
import com.sanalpos.infrastructure.pos.AbstractVirtualPosAdapter;
import com.sanalpos.infrastructure.pos.BankAdapterConfig;
import com.sanalpos.infrastructure.pos.BankEndpoints;
import com.sanalpos.infrastructure.pos.BankReply;
import com.sanalpos.infrastructure.pos.CallbackData;
import com.sanalpos.infrastructure.pos.CancelRequest;
import com.sanalpos.infrastructure.pos.CancelResponse;
import com.sanalpos.infrastructure.pos.PaymentRequest;
import com.sanalpos.infrastructure.pos.PaymentResponse;
import com.sanalpos.infrastructure.pos.RefundRequest;
import com.sanalpos.infrastructure.pos.RefundResponse;
import com.sanalpos.infrastructure.pos.signature.SignatureInput;
import com.sanalpos.infrastructure.pos.support.AutoSubmitForm;
import com.sanalpos.infrastructure.pos.support.JsonFields;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * İşbank virtual POS: JSON requests to the {@code /vpos} API and a 3D gate form that carries the
 * card data.
 */
public class IsbankPosAdapter extends AbstractVirtualPosAdapter {
    public static final BankEndpoints ENDPOINTS = new BankEndpoints(
            "https://apitest.isbank.com.tr",
            "https://apitest.isbank.com.tr/vpos/3d-gate",
            "https://api.isbank.com.tr",
            "https://api.isbank.com.tr/vpos/3d-gate"
    );

    static final String PAYMENT_PATH = "/vpos/payment";
    static final String REFUND_PATH = "/vpos/refund";
    static final String CANCEL_PATH = "/vpos/cancel";
    static final String APPROVED_CODE = "00";

    private final ObjectMapper objectMapper;

    public IsbankPosAdapter(BankAdapterConfig config, WebClient webClient, ObjectMapper objectMapper,
                            Duration timeout, Clock clock) {
        super(config, new IsbankSignatureEngine(config), webClient, timeout, clock);
        this.objectMapper = objectMapper;
        config.require("merchantId", config.merchantId());
        config.require("terminalId", config.terminalId());
        config.require("storeKey", config.storeKey());
        config.require("apiUrl", config.apiUrl());
        config.require("secure3dUrl", config.secure3dUrl());
    }

    @Override
    public PaymentResponse payment(PaymentRequest request) {
        CurrencyCode currency = validatePayment(request, true);
        logRequest("payment", request);

        String hash = signatureEngine.computeSignature(OperationType.SALE, base(request.orderId(), IsbankMessages.TYPE_SALE)
                .amount(request.amount())
                .currencyCode(currency.numericCode())
                .build());

        Map<String, Object> body = IsbankMessages.payment(
                config.merchantId(),
                config.terminalId(),
                request.orderId(),
                signatureEngine.amountFormat().format(request.amount()),
                currency.numericCode(),
                request.installmentCount(),
                new IsbankMessages.Card(
                        Cards.digitsOnly(request.cardNumber()),
                        request.cardHolderName(),
                        request.expireMonthTwoDigits(),
                        request.expireYearTwoDigits(),
                        request.cardCvv().trim()),
                new IsbankMessages.Customer(
                        request.customerName(),
                        request.customerEmail(),
                        request.customerPhone(),
                        request.customerIpAddress()),
                hash
        );

        String raw = send("payment", PAYMENT_PATH, body);
        BankReply reply = parse(objectMapper, raw);
        logDecision("payment", request.orderId(), reply);
        return reply.toPaymentResponse(raw);
    }

    @Override
    public PaymentResponse payment3D(PaymentRequest request) {
        CurrencyCode currency = validatePayment(request, true);
        logRequest("payment3D", request);

        String successUrl = successUrl(request);
        String failUrl = failUrl(request);
        String installment = Integer.toString(request.installmentCount());
        String hash = signatureEngine.computeSignature(OperationType.THREE_D_SECURE,
                base(request.orderId(), IsbankMessages.TYPE_SALE)
                        .amount(request.amount())
                        .currencyCode(currency.numericCode())
                        .successUrl(successUrl)
                        .failUrl(failUrl)
                        .installment(installment)
                        .build());

        String html = AutoSubmitForm.postTo(config.secure3dUrl())
                .field("merchantId", config.merchantId())
                .field("terminalId", config.terminalId())
                .field("orderId", request.orderId())
                .field("transactionType", IsbankMessages.TYPE_SALE)
                .field("amount", signatureEngine.amountFormat().format(request.amount()))
                .field("currency", currency.numericCode())
                .field("installment", installment)
                .field("successUrl", successUrl)
                .field("failUrl", failUrl)
                .field("cardNumber", Cards.digitsOnly(request.cardNumber()))
                .field("cardHolderName", request.cardHolderName())
                .field("cardExpiryMonth", request.expireMonthTwoDigits())
                .field("cardExpiryYear", request.expireYearTwoDigits())
                .field("cardCvv", request.cardCvv().trim())
                .field("customerEmail", request.customerEmail())
                .field("lang", "tr")
                .field("hash", hash)
                .render();

        log.info("{} 3D form generated orderId={}", bank(), request.orderId());
        return PaymentResponse.threeDSecureForm(html);
    }

    @Override
    public RefundResponse refund(RefundRequest request) {
        validateRefund(request);
        log.debug("{} refund request orderId={} transactionId={} amount={}",
                bank(), request.orderId(), request.transactionId(), request.amount());

        String currencyCode = request.currency() == null ? null : currency(request.currency()).numericCode();
        String hash = signatureEngine.computeSignature(OperationType.REFUND,
                base(request.orderId(), IsbankMessages.TYPE_REFUND)
                        .amount(request.amount())
                        .currencyCode(currencyCode)
                        .build());

        Map<String, Object> body = IsbankMessages.refund(
                config.merchantId(),
                config.terminalId(),
                request.orderId(),
                request.transactionId(),
                formatOrEmpty(request.amount(), signatureEngine.amountFormat()),
                currencyCode,
                request.reason(),
                hash
        );

        String raw = send("refund", REFUND_PATH, body);
        BankReply reply = parse(objectMapper, raw);
        logDecision("refund", request.orderId(), reply);
        return reply.toRefundResponse(request.transactionId(), request.amount(), raw);
    }

    @Override
    public CancelResponse cancel(CancelRequest request) {
        validateCancel(request);
        log.debug("{} cancel request orderId={} transactionId={}", bank(), request.orderId(), request.transactionId());

        String hash = signatureEngine.computeSignature(OperationType.VOID,
                base(request.orderId(), IsbankMessages.TYPE_CANCEL).build());

        Map<String, Object> body = IsbankMessages.cancel(
                config.merchantId(),
                config.terminalId(),
                request.orderId(),
                request.transactionId(),
                request.authCode(),
                hash
        );

        String raw = send("cancel", CANCEL_PATH, body);
        BankReply reply = parse(objectMapper, raw);
        logDecision("cancel", request.orderId(), reply);
        return reply.toCancelResponse(request.transactionId(), raw);
    }

    @Override
    protected List<String> requiredCallbackFields() {
        return List.of("orderId", "terminalId", "amount", "mdStatus", "responseCode", "hash");
    }

    @Override
    protected CallbackCheck readCallback(CallbackData data) {
        String responseCode = data.get("responseCode").trim();
        SignatureInput input = SignatureInput.builder()
                .orderId(data.get("orderId"))
                .terminalId(config.terminalId())
                .echoedAmount(data.get("amount"))
                .mdStatus(data.get("mdStatus"))
                .responseCode(responseCode)
                .build();
        return new CallbackCheck(data.get("orderId"), input, data.get("hash"), data.get("mdStatus"),
                APPROVED_CODE.equals(responseCode));
    }

    @Override
    protected BankReply parseReply(String body) {
        return parse(objectMapper, body);
    }

    static BankReply parse(ObjectMapper objectMapper, String body) {
        JsonNode json = JsonFields.parse(objectMapper, body);
        String referenceNumber = JsonFields.text(json, "referenceNumber");
        return BankReply.of(
                JsonFields.text(json, "responseCode"),
                APPROVED_CODE,
                JsonFields.text(json, "responseMessage"),
                JsonFields.text(json, "transactionId"),
                referenceNumber,
                JsonFields.text(json, "authCode"),
                referenceNumber
        );
    }

    private SignatureInput.Builder base(String orderId, String transactionType) {
        return SignatureInput.builder()
                .merchantId(config.merchantId())
                .terminalId(config.terminalId())
                .orderId(orderId)
                .transactionType(transactionType);
    }

    private String send(String operation, String path, Map<String, Object> body) {
        return post(operation, config.apiUrl() + path, MediaType.APPLICATION_JSON, BodyInserters.fromValue(body));
    }
}
