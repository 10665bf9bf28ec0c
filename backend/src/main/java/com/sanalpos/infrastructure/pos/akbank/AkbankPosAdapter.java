/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.akbank;

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
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Akbank virtual POS. Direct operations are URL-encoded posts answered with JSON; 3D Secure uses
 * the bank's hosted payment page, so the card is entered at Akbank and never passes through here.
 */
public class AkbankPosAdapter extends AbstractVirtualPosAdapter {
    public static final BankEndpoints ENDPOINTS = new BankEndpoints(
            "https://testpayment.akbank.com/fim/api",
            "https://testpayment.akbank.com/fim/est3Dgate",
            "https://virtualpayment.akbank.com/fim/api",
            "https://virtualpayment.akbank.com/fim/est3Dgate"
    );

    static final String APPROVED_CODE = "00";
    static final String STORE_TYPE = "3d_pay_hosting";

    private final ObjectMapper objectMapper;

    public AkbankPosAdapter(BankAdapterConfig config, WebClient webClient, ObjectMapper objectMapper,
                            Duration timeout, Clock clock) {
        super(config, new AkbankSignatureEngine(config), webClient, timeout, clock);
        this.objectMapper = objectMapper;
        config.require("merchantId", config.merchantId());
        config.require("storeKey", config.storeKey());
        config.require("apiUrl", config.apiUrl());
        config.require("secure3dUrl", config.secure3dUrl());
    }

    @Override
    public PaymentResponse payment(PaymentRequest request) {
        CurrencyCode currency = validatePayment(request, true);
        logRequest("payment", request);

        String hash = signatureEngine.computeSignature(OperationType.SALE, SignatureInput.builder()
                .merchantId(config.merchantId())
                .orderId(request.orderId())
                .amount(request.amount())
                .build());

        MultiValueMap<String, String> form = AkbankForms.sale(
                config.merchantId(),
                request.orderId(),
                signatureEngine.amountFormat().format(request.amount()),
                currency.numericCode(),
                installmentOrEmpty(request.installmentCount()),
                Cards.digitsOnly(request.cardNumber()),
                request.expireMonthTwoDigits(),
                request.expireYearTwoDigits(),
                request.cardCvv().trim(),
                request.customerEmail(),
                hash
        );

        String raw = send("payment", form);
        BankReply reply = parse(objectMapper, raw);
        logDecision("payment", request.orderId(), reply);
        return reply.toPaymentResponse(raw);
    }

    @Override
    public PaymentResponse payment3D(PaymentRequest request) {
        CurrencyCode currency = validatePayment(request, false);
        logRequest("payment3D", request);

        String successUrl = successUrl(request);
        String failUrl = failUrl(request);
        String hash = signatureEngine.computeSignature(OperationType.THREE_D_SECURE, SignatureInput.builder()
                .merchantId(config.merchantId())
                .orderId(request.orderId())
                .amount(request.amount())
                .successUrl(successUrl)
                .failUrl(failUrl)
                .build());

        String html = AutoSubmitForm.postTo(config.secure3dUrl())
                .field("clientId", config.merchantId())
                .field("storetype", STORE_TYPE)
                .field("islemtipi", AkbankForms.TYPE_AUTH)
                .field("amount", signatureEngine.amountFormat().format(request.amount()))
                .field("currency", currency.numericCode())
                .field("oid", request.orderId())
                .field("okUrl", successUrl)
                .field("failUrl", failUrl)
                .field("taksit", installmentOrEmpty(request.installmentCount()))
                .field("lang", "tr")
                .field("email", request.customerEmail())
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

        String hash = signatureEngine.computeSignature(OperationType.REFUND, SignatureInput.builder()
                .merchantId(config.merchantId())
                .orderId(request.orderId())
                .amount(request.amount())
                .build());

        String currencyCode = request.currency() == null ? null : currency(request.currency()).numericCode();
        MultiValueMap<String, String> form = AkbankForms.refund(
                config.merchantId(),
                request.orderId(),
                request.transactionId(),
                formatOrEmpty(request.amount(), signatureEngine.amountFormat()),
                currencyCode,
                hash
        );

        String raw = send("refund", form);
        BankReply reply = parse(objectMapper, raw);
        logDecision("refund", request.orderId(), reply);
        return reply.toRefundResponse(request.transactionId(), request.amount(), raw);
    }

    @Override
    public CancelResponse cancel(CancelRequest request) {
        validateCancel(request);
        log.debug("{} cancel request orderId={} transactionId={}", bank(), request.orderId(), request.transactionId());

        String hash = signatureEngine.computeSignature(OperationType.VOID, SignatureInput.builder()
                .merchantId(config.merchantId())
                .orderId(request.orderId())
                .build());

        String raw = send("cancel", AkbankForms.cancel(config.merchantId(), request.orderId(), request.transactionId(), hash));
        BankReply reply = parse(objectMapper, raw);
        logDecision("cancel", request.orderId(), reply);
        return reply.toCancelResponse(request.transactionId(), raw);
    }

    @Override
    protected List<String> requiredCallbackFields() {
        return List.of("oid", "amount", "mdStatus", "ProcReturnCode", "HASH");
    }

    /**
     * The expected hash is built with this terminal's own client id, so a callback issued for
     * another merchant fails the signature check.
     */
    @Override
    protected CallbackCheck readCallback(CallbackData data) {
        String returnCode = data.get("ProcReturnCode").trim();
        SignatureInput input = SignatureInput.builder()
                .merchantId(config.merchantId())
                .orderId(data.get("oid"))
                .echoedAmount(data.get("amount"))
                .responseCode(returnCode)
                .mdStatus(data.get("mdStatus"))
                .build();
        return new CallbackCheck(data.get("oid"), input, data.get("HASH"), data.get("mdStatus"),
                APPROVED_CODE.equals(returnCode));
    }

    @Override
    protected BankReply parseReply(String body) {
        return parse(objectMapper, body);
    }

    static BankReply parse(ObjectMapper objectMapper, String body) {
        JsonNode json = JsonFields.parse(objectMapper, body);
        String hostRef = JsonFields.text(json, "HostRefNum");
        return BankReply.of(
                JsonFields.text(json, "ProcReturnCode"),
                APPROVED_CODE,
                JsonFields.text(json, "ErrMsg"),
                JsonFields.text(json, "TransId"),
                hostRef,
                JsonFields.text(json, "AuthCode"),
                hostRef
        );
    }

    private String send(String operation, MultiValueMap<String, String> form) {
        return post(operation, config.apiUrl(), MediaType.APPLICATION_FORM_URLENCODED, BodyInserters.fromFormData(form));
    }
}
