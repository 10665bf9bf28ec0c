/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.akbank;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sanalpos.domain.model.BankCode;
import com.sanalpos.domain.model.OperationType;
import com.sanalpos.infrastructure.pos.BankAdapterConfig;
import com.sanalpos.infrastructure.pos.BankReply;
import com.sanalpos.infrastructure.pos.CallbackData;
import com.sanalpos.infrastructure.pos.CancelRequest;
import com.sanalpos.infrastructure.pos.CancelResponse;
import com.sanalpos.infrastructure.pos.PaymentRequest;
import com.sanalpos.infrastructure.pos.PaymentResponse;
import com.sanalpos.infrastructure.pos.RefundRequest;
import com.sanalpos.infrastructure.pos.RefundResponse;
import com.sanalpos.infrastructure.pos.StubExchange;
import com.sanalpos.infrastructure.pos.VirtualPosErrorType;
import com.sanalpos.infrastructure.pos.VirtualPosException;
import com.sanalpos.infrastructure.pos.signature.SignatureInput;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AkbankPosAdapterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T10:00:00Z"), ZoneOffset.UTC);
    private static final BankAdapterConfig CONFIG = new BankAdapterConfig(BankCode.AKBANK,
            "100200300", null, null, null, "AKBANK_TEST_STORE_KEY",
            "https://akbank.test/fim/api", "https://akbank.test/fim/est3Dgate", true, "https://shop.example.com");

    private static final String APPROVED = "{\"ProcReturnCode\":\"00\",\"Response\":\"Approved\","
            + "\"TransId\":\"25166PKJA11234\",\"AuthCode\":\"P12345\",\"HostRefNum\":\"516600012345\"}";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AkbankPosAdapter adapter(StubExchange stub) {
        return new AkbankPosAdapter(CONFIG, stub.webClient(), objectMapper, Duration.ofSeconds(5), CLOCK);
    }

    private static PaymentRequest.Builder payment() {
        return PaymentRequest.builder()
                .orderId("ORDER123")
                .amount(new BigDecimal("10.50"))
                .card("4111111111111111", "Ayse Yilmaz", "12", "2030", "123")
                .customer("Ayse Yilmaz", "buyer@example.com", null);
    }

    @Test
    void approvedPaymentIsNormalized() {
        StubExchange stub = StubExchange.json(APPROVED);

        PaymentResponse response = adapter(stub).payment(payment().build());

        assertTrue(response.success());
        assertEquals("25166PKJA11234", response.transactionId());
        assertEquals("516600012345", response.referenceNumber());
        assertEquals("P12345", response.authCode());
        assertEquals("https://akbank.test/fim/api", stub.lastRequest().url().toString());
        assertTrue(stub.lastRequest().headers().getFirst(HttpHeaders.CONTENT_TYPE)
                .startsWith(MediaType.APPLICATION_FORM_URLENCODED_VALUE));
    }

    @Test
    void declinedPaymentCarriesBankCode() {
        StubExchange stub = StubExchange.json("{\"ProcReturnCode\":\"05\",\"ErrMsg\":\"Do not honour\"}");

        PaymentResponse response = adapter(stub).payment(payment().build());

        assertFalse(response.success());
        assertEquals("05", response.errorCode());
        assertEquals("Do not honour", response.errorMessage());
    }

    @Test
    void unparseableBodyIsAFailureNotASuccess() {
        StubExchange stub = StubExchange.respond(HttpStatus.OK, MediaType.TEXT_HTML, "<html>maintenance</html>");

        PaymentResponse response = adapter(stub).payment(payment().build());

        assertFalse(response.success());
        assertEquals(BankReply.MISSING_RESPONSE_CODE, response.errorCode());
    }

    @Test
    void clientErrorWithBankCodeIsADecline() {
        StubExchange stub = StubExchange.respond(HttpStatus.UNPROCESSABLE_ENTITY, MediaType.APPLICATION_JSON,
                "{\"ProcReturnCode\":\"99\",\"ErrMsg\":\"Hash dogrulanamadi\"}");

        PaymentResponse response = adapter(stub).payment(payment().build());

        assertFalse(response.success());
        assertEquals("99", response.errorCode());
        assertEquals("Hash dogrulanamadi", response.errorMessage());
    }

    @Test
    void decimalAmountsBeyondKurusAreRejected() {
        StubExchange stub = StubExchange.json(APPROVED);
        AkbankPosAdapter adapter = adapter(stub);

        VirtualPosException payment = assertThrows(VirtualPosException.class,
                () -> adapter.payment(payment().amount(new BigDecimal("10.005")).build()));
        VirtualPosException refund = assertThrows(VirtualPosException.class,
                () -> adapter.refund(new RefundRequest("25166PKJA11234", "ORDER123", new BigDecimal("1.001"), "TRY", null)));

        assertEquals(VirtualPosErrorType.VALIDATION, payment.getType());
        assertEquals(VirtualPosErrorType.VALIDATION, refund.getType());
        assertTrue(stub.requests().isEmpty());
    }

    @Test
    void serverErrorIsIndeterminate() {
        StubExchange stub = StubExchange.respond(HttpStatus.BAD_GATEWAY, MediaType.TEXT_HTML, "bad gateway");

        VirtualPosException ex = assertThrows(VirtualPosException.class, () -> adapter(stub).payment(payment().build()));

        assertEquals(VirtualPosErrorType.HTTP_ERROR, ex.getType());
        assertTrue(ex.isOutcomeIndeterminate());
    }

    @Test
    void saleFormCarriesSignedFields() {
        MultiValueMap<String, String> form = AkbankForms.sale("100200300", "ORDER123", "10.50", "949", "",
                "4111111111111111", "12", "30", "123", null, "HASH");

        assertEquals("100200300", form.getFirst("clientId"));
        assertEquals("Auth", form.getFirst("islemtipi"));
        assertEquals("10.50", form.getFirst("amount"));
        assertEquals("949", form.getFirst("currency"));
        assertEquals("HASH", form.getFirst("hash"));
        assertFalse(form.containsKey("taksit"));
        assertFalse(form.containsKey("email"));
    }

    @Test
    void refundAndCancelFormsReferenceTheOriginalTransaction() {
        MultiValueMap<String, String> refund = AkbankForms.refund("100200300", "ORDER123", "T-1", "", null, "H");
        MultiValueMap<String, String> cancel = AkbankForms.cancel("100200300", "ORDER123", "T-1", "H");

        assertEquals("Credit", refund.getFirst("islemtipi"));
        assertEquals("T-1", refund.getFirst("transId"));
        assertFalse(refund.containsKey("amount"));
        assertEquals("Void", cancel.getFirst("islemtipi"));
        assertEquals(List.of("clientId", "oid", "islemtipi", "transId", "hash"), List.copyOf(cancel.keySet()));
    }

    @Test
    void hostedThreeDFormNeedsNoCardData() {
        PaymentRequest request = PaymentRequest.builder()
                .orderId("ORDER123")
                .amount(new BigDecimal("10.50"))
                .successUrl("https://shop.example.com/ok")
                .failUrl("https://shop.example.com/fail")
                .build();

        String html = adapter(StubExchange.json(APPROVED)).payment3D(request).htmlContent();

        assertTrue(html.contains("action=\"https://akbank.test/fim/est3Dgate\""));
        assertTrue(html.contains("name=\"okUrl\" value=\"https://shop.example.com/ok\""));
        assertTrue(html.contains("name=\"failUrl\" value=\"https://shop.example.com/fail\""));
        assertTrue(html.contains("name=\"storetype\" value=\"3d_pay_hosting\""));
        assertTrue(html.contains("name=\"amount\" value=\"10.50\""));
        assertFalse(html.contains("name=\"pan\""));
        assertFalse(html.contains("4111111111111111"));
    }

    @Test
    void refundAndCancelAreNormalized() {
        AkbankPosAdapter adapter = adapter(StubExchange.json(APPROVED));

        RefundResponse refund = adapter.refund(new RefundRequest("25166PKJA11234", "ORDER123", null, null, null));
        CancelResponse cancel = adapter.cancel(new CancelRequest("25166PKJA11234", "ORDER123", null));

        assertTrue(refund.success());
        assertEquals("25166PKJA11234", refund.transactionId());
        assertNull(refund.amount());
        assertTrue(cancel.success());
        assertEquals("25166PKJA11234", cancel.transactionId());
    }

    @Test
    void authenticCallbackIsAccepted() {
        assertTrue(adapter(StubExchange.json(APPROVED)).verifyCallback(CallbackData.of(callback("1", "00"))));
    }

    @Test
    void callbackKeysAreMatchedIgnoringCase() {
        Map<String, String> fields = callback("1", "00");
        fields.put("hash", fields.remove("HASH"));
        fields.put("mdstatus", fields.remove("mdStatus"));

        assertTrue(adapter(StubExchange.json(APPROVED)).verifyCallback(CallbackData.of(fields)));
    }

    @Test
    void tamperedCallbackIsRejected() {
        Map<String, String> fields = callback("1", "00");
        fields.put("amount", "1.00");

        assertFalse(adapter(StubExchange.json(APPROVED)).verifyCallback(CallbackData.of(fields)));
    }

    @Test
    void unauthenticatedOrDeclinedCallbackIsRejected() {
        AkbankPosAdapter adapter = adapter(StubExchange.json(APPROVED));

        assertFalse(adapter.verifyCallback(CallbackData.of(callback("2", "00"))));
        assertFalse(adapter.verifyCallback(CallbackData.of(callback("1", "99"))));
    }

    @Test
    void missingStoreKeyFailsConstruction() {
        BankAdapterConfig noKey = new BankAdapterConfig(BankCode.AKBANK, "100200300", null, null, null, " ",
                "https://akbank.test/fim/api", "https://akbank.test/fim/est3Dgate", true, null);

        VirtualPosException ex = assertThrows(VirtualPosException.class,
                () -> new AkbankPosAdapter(noKey, StubExchange.json(APPROVED).webClient(), objectMapper,
                        Duration.ofSeconds(1), CLOCK));

        assertTrue(ex.isConfigurationError());
    }

    private static Map<String, String> callback(String mdStatus, String returnCode) {
        String hash = new AkbankSignatureEngine(CONFIG).computeSignature(OperationType.CALLBACK,
                SignatureInput.builder()
                        .merchantId("100200300")
                        .orderId("ORDER123")
                        .echoedAmount("10.50")
                        .responseCode(returnCode)
                        .mdStatus(mdStatus)
                        .build());
        Map<String, String> fields = new HashMap<>();
        fields.put("clientid", "100200300");
        fields.put("oid", "ORDER123");
        fields.put("amount", "10.50");
        fields.put("mdStatus", mdStatus);
        fields.put("ProcReturnCode", returnCode);
        fields.put("HASH", hash);
        return fields;
    }
}
