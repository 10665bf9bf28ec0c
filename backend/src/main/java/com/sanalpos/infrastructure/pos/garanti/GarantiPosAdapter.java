/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.garanti;

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
import com.sanalpos.infrastructure.pos.signature.SignatureFields;
import com.sanalpos.infrastructure.pos.signature.SignatureInput;
import com.sanalpos.infrastructure.pos.support.AutoSubmitForm;
import com.sanalpos.infrastructure.pos.support.XmlTags;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Garanti BBVA virtual POS: {@code GVPSRequest} XML for direct operations and the
 * {@code gt3dengine} form for 3D Secure, which carries the card data.
 */
public class GarantiPosAdapter extends AbstractVirtualPosAdapter {
    public static final BankEndpoints ENDPOINTS = new BankEndpoints(
            "https://sanalposprovtest.garantibbva.com.tr/VPServlet",
            "https://sanalposprovtest.garantibbva.com.tr/servlet/gt3dengine",
            "https://sanalposprov.garanti.com.tr/VPServlet",
            "https://sanalposprov.garanti.com.tr/servlet/gt3dengine"
    );

    static final String API_VERSION = "v0.01";
    static final String TYPE_SALES = "sales";
    static final String TYPE_REFUND = "refund";
    static final String TYPE_VOID = "void";
    static final String APPROVED_CODE = "00";
    static final String SERVER_IP = "127.0.0.1";
    private static final MediaType TEXT_XML_UTF8 = new MediaType(MediaType.TEXT_XML, StandardCharsets.UTF_8);

    public GarantiPosAdapter(BankAdapterConfig config, WebClient webClient, Duration timeout, Clock clock) {
        super(config, new GarantiSignatureEngine(config), webClient, timeout, clock);
        config.require("merchantId", config.merchantId());
        config.require("terminalId", config.terminalId());
        config.require("username", config.username());
        config.require("password", config.password());
        config.require("apiUrl", config.apiUrl());
        config.require("secure3dUrl", config.secure3dUrl());
    }

    @Override
    public PaymentResponse payment(PaymentRequest request) {
        CurrencyCode currency = validatePayment(request, true);
        logRequest("payment", request);

        String amount = signatureEngine.amountFormat().format(request.amount());
        String cardNumber = Cards.digitsOnly(request.cardNumber());
        String hash = signatureEngine.computeSignature(OperationType.SALE, SignatureInput.builder()
                .orderId(request.orderId())
                .terminalId(config.terminalId())
                .amount(request.amount())
                .cardNumber(cardNumber)
                .build());

        GvpsRequest gvps = new GvpsRequest(
                mode(),
                API_VERSION,
                terminal(hash),
                new GvpsRequest.Customer(ipAddress(request), request.customerEmail()),
                new GvpsRequest.Card(cardNumber,
                        request.expireMonthTwoDigits() + request.expireYearTwoDigits(),
                        request.cardCvv().trim()),
                new GvpsRequest.Order(request.orderId(), ""),
                new GvpsRequest.Transaction(TYPE_SALES, installment(request.installmentCount()), amount,
                        currency.numericCode(), request.cardHolderName(), "N", null)
        );

        String raw = send("payment", gvps);
        BankReply reply = parse(raw);
        logDecision("payment", request.orderId(), reply);
        return reply.toPaymentResponse(raw);
    }

    @Override
    public PaymentResponse payment3D(PaymentRequest request) {
        CurrencyCode currency = validatePayment(request, true);
        logRequest("payment3D", request);

        String amount = signatureEngine.amountFormat().format(request.amount());
        String installment = installment(request.installmentCount());
        String successUrl = successUrl(request);
        String failUrl = failUrl(request);
        String hash = signatureEngine.computeSignature(OperationType.THREE_D_SECURE, SignatureInput.builder()
                .terminalId(config.terminalId())
                .orderId(request.orderId())
                .amount(request.amount())
                .successUrl(successUrl)
                .failUrl(failUrl)
                .transactionType(TYPE_SALES)
                .installment(installment)
                .build());

        String html = AutoSubmitForm.postTo(config.secure3dUrl())
                .field("mode", mode())
                .field("apiversion", API_VERSION)
                .field("terminalprovuserid", config.username())
                .field("terminaluserid", config.username())
                .field("terminalmerchantid", config.merchantId())
                .field("terminalid", config.terminalId())
                .field("txntype", TYPE_SALES)
                .field("txnamount", amount)
                .field("txncurrencycode", currency.numericCode())
                .field("txninstallmentcount", installment)
                .field("orderid", request.orderId())
                .field("successurl", successUrl)
                .field("errorurl", failUrl)
                .field("customeremailaddress", request.customerEmail())
                .field("customeripaddress", ipAddress(request))
                .field("secure3dhash", hash)
                .field("cardnumber", Cards.digitsOnly(request.cardNumber()))
                .field("cardexpiredatemonth", request.expireMonthTwoDigits())
                .field("cardexpiredateyear", request.expireYearTwoDigits())
                .field("cardcvv2", request.cardCvv().trim())
                .render();

        log.info("{} 3D form generated orderId={}", bank(), request.orderId());
        return PaymentResponse.threeDSecureForm(html);
    }

    @Override
    public RefundResponse refund(RefundRequest request) {
        validateRefund(request);
        log.debug("{} refund request orderId={} transactionId={} amount={}",
                bank(), request.orderId(), request.transactionId(), request.amount());

        String amount = formatOrEmpty(request.amount(), signatureEngine.amountFormat());
        String hash = signatureEngine.computeSignature(OperationType.REFUND, SignatureInput.builder()
                .orderId(request.orderId())
                .terminalId(config.terminalId())
                .amount(request.amount())
                .build());

        String currencyCode = request.currency() == null ? null : currency(request.currency()).numericCode();
        GvpsRequest gvps = new GvpsRequest(
                mode(),
                API_VERSION,
                terminal(hash),
                new GvpsRequest.Customer(SERVER_IP, null),
                null,
                new GvpsRequest.Order(request.orderId(), null),
                new GvpsRequest.Transaction(TYPE_REFUND, null, amount, currencyCode, null, null,
                        request.transactionId())
        );

        String raw = send("refund", gvps);
        BankReply reply = parse(raw);
        logDecision("refund", request.orderId(), reply);
        return reply.toRefundResponse(request.transactionId(), request.amount(), raw);
    }

    @Override
    public CancelResponse cancel(CancelRequest request) {
        validateCancel(request);
        log.debug("{} cancel request orderId={} transactionId={}", bank(), request.orderId(), request.transactionId());

        String hash = signatureEngine.computeSignature(OperationType.VOID, SignatureInput.builder()
                .orderId(request.orderId())
                .terminalId(config.terminalId())
                .build());

        GvpsRequest gvps = new GvpsRequest(
                mode(),
                API_VERSION,
                terminal(hash),
                new GvpsRequest.Customer(SERVER_IP, null),
                null,
                new GvpsRequest.Order(request.orderId(), null),
                new GvpsRequest.Transaction(TYPE_VOID, null, null, null, null, null, request.transactionId())
        );

        String raw = send("cancel", gvps);
        BankReply reply = parse(raw);
        logDecision("cancel", request.orderId(), reply);
        return reply.toCancelResponse(request.transactionId(), raw);
    }

    @Override
    protected List<String> requiredCallbackFields() {
        return List.of("mdstatus", "txnstatus", "hashdata", "terminalid", "orderid", "txnamount");
    }

    @Override
    protected CallbackCheck readCallback(CallbackData data) {
        SignatureInput input = SignatureInput.builder()
                .orderId(data.get("orderid"))
                .terminalId(config.terminalId())
                .echoedAmount(data.get("txnamount"))
                .transactionStatus(data.get("txnstatus"))
                .mdStatus(data.get("mdstatus"))
                .build();
        boolean approved = "Y".equalsIgnoreCase(data.get("txnstatus").trim());
        return new CallbackCheck(data.get("orderid"), input, data.get("hashdata"), data.get("mdstatus"), approved);
    }

    @Override
    protected BankReply parseReply(String body) {
        return parse(body);
    }

    static BankReply parse(String xml) {
        String message = XmlTags.extract(xml, "ErrorMsg");
        if (message.isBlank()) message = XmlTags.extract(xml, "SysErrMsg");
        String retrefNum = XmlTags.extract(xml, "RetrefNum");
        return BankReply.of(
                XmlTags.extract(xml, "Code"),
                APPROVED_CODE,
                message,
                retrefNum,
                retrefNum,
                XmlTags.extract(xml, "AuthCode"),
                XmlTags.extract(xml, "BatchNum")
        );
    }

    static String installment(int installmentCount) {
        return installmentCount > 1 ? SignatureFields.padLeft(Integer.toString(installmentCount), 2, '0') : "";
    }

    private String send(String operation, GvpsRequest gvps) {
        return post(operation, config.apiUrl(), TEXT_XML_UTF8, BodyInserters.fromValue(gvps.toXml()));
    }

    private GvpsRequest.Terminal terminal(String hash) {
        return new GvpsRequest.Terminal(config.username(), hash, config.username(), config.terminalId(), config.merchantId());
    }

    private String mode() {
        return config.testMode() ? "TEST" : "PROD";
    }

    private static String ipAddress(PaymentRequest request) {
        return isBlank(request.customerIpAddress()) ? SERVER_IP : request.customerIpAddress();
    }
}
