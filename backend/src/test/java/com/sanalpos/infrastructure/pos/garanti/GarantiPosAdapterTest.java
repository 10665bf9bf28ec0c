/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.infrastructure.pos.garanti;

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
import org.junit.jupiter.api.function.Executable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GarantiPosAdapterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T10:00:00Z"), ZoneOffset.UTC);
    private static final BankAdapterConfig CONFIG = new BankAdapterConfig(BankCode.GARANTI,
            "7000679", "30691298", "PROVAUT", "123qweASD/", "12345678",
            "https://garanti.test/VPServlet", "https://garanti.test/servlet/gt3dengine", true,
            "https://shop.example.com");

    private static final String APPROVED = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<GVPSResponse><Transaction><Response><Source>HOST</Source><Code>00</Code>"
            + "<ReasonCode>00</ReasonCode><Message>Approved</Message><ErrorMsg></ErrorMsg>"
            + "<SysErrMsg></SysErrMsg></Response><RetrefNum>516610237283</RetrefNum>"
            + "<AuthCode>304919</AuthCode><BatchNum>004951</BatchNum></Transaction></GVPSResponse>";

    private static final String DECLINED = "<GVPSResponse><Transaction><Response><Code>51</Code>"
            + "<Message>Declined</Message><ErrorMsg>Yetersiz bakiye</ErrorMsg>"
            + "<SysErrMsg>INSUFFICIENT FUNDS</SysErrMsg></Response></Transaction></GVPSResponse>";

    private static GarantiPosAdapter adapter(StubExchange stub) {
        return new GarantiPosAdapter(CONFIG, stub.webClient(), Duration.ofSeconds(5), CLOCK);
    }

    private static PaymentRequest.Builder payment() {
        return PaymentRequest.builder()
                .orderId("ORDER123")
                .amount(new BigDecimal("10.50"))
                .currency("TRY")
                .card("4111111111111111", "Ayse Yilmaz", "12", "2030", "123")
                .customer("Ayse Yilmaz", "buyer@example.com", "5551234567")
                .customerIpAddress("10.0.0.1");
    }

    @Test
    void approvedPaymentIsNormalized() {
        StubExchange stub = StubExchange.xml(APPROVED);

        PaymentResponse response = adapter(stub).payment(payment().build());

        assertTrue(response.success());
        assertEquals("516610237283", response.transactionId());
        assertEquals("516610237283", response.referenceNumber());
        assertEquals("304919", response.authCode());
        assertEquals("004951", response.provisionNumber());
        assertNull(response.errorCode());
        assertNull(response.htmlContent());
        assertEquals(APPROVED, response.rawResponse());

        assertEquals(1, stub.requests().size());
        assertEquals(HttpMethod.POST, stub.lastRequest().method());
        assertEquals("https://garanti.test/VPServlet", stub.lastRequest().url().toString());
        assertTrue(stub.lastRequest().headers().getFirst(HttpHeaders.CONTENT_TYPE).startsWith("text/xml"));
    }

    @Test
    void declinedPaymentCarriesBankCodeWithoutThrowing() {
        PaymentResponse response = adapter(StubExchange.xml(DECLINED)).payment(payment().build());

        assertFalse(response.success());
        assertEquals("51", response.errorCode());
        assertEquals("Yetersiz bakiye", response.errorMessage());
        assertNull(response.transactionId());
    }

    @Test
    void responseWithoutCodeIsAFailure() {
        PaymentResponse response = adapter(StubExchange.xml("<GVPSResponse><Transaction/></GVPSResponse>"))
                .payment(payment().build());

        assertFalse(response.success());
        assertEquals(BankReply.MISSING_RESPONSE_CODE, response.errorCode());
    }

    @Test
    void sysErrMsgIsUsedWhenErrorMsgIsEmpty() {
        BankReply reply = GarantiPosAdapter.parse("<Code>99</Code><ErrorMsg></ErrorMsg><SysErrMsg>HASH ERROR</SysErrMsg>");

        assertFalse(reply.approved());
        assertEquals("HASH ERROR", reply.message());
    }

    @Test
    void timeoutIsIndeterminate() {
        GarantiPosAdapter adapter = new GarantiPosAdapter(CONFIG, StubExchange.hang().webClient(),
                Duration.ofMillis(200), CLOCK);

        VirtualPosException ex = assertThrows(VirtualPosException.class, () -> adapter.payment(payment().build()));

        assertEquals(VirtualPosErrorType.TIMEOUT, ex.getType());
        assertTrue(ex.isOutcomeIndeterminate());
    }

    @Test
    void connectionFailureIsIndeterminate() {
        VirtualPosException ex = assertThrows(VirtualPosException.class,
                () -> adapter(StubExchange.refuseConnection()).payment(payment().build()));

        assertEquals(VirtualPosErrorType.CONNECTION, ex.getType());
        assertTrue(ex.isOutcomeIndeterminate());
    }

    @Test
    void serverErrorIsIndeterminate() {
        StubExchange stub = StubExchange.respond(HttpStatus.SERVICE_UNAVAILABLE, MediaType.TEXT_HTML, "down");

        VirtualPosException ex = assertThrows(VirtualPosException.class, () -> adapter(stub).payment(payment().build()));

        assertEquals(VirtualPosErrorType.HTTP_ERROR, ex.getType());
        assertEquals(503, ex.getHttpStatus());
        assertTrue(ex.isOutcomeIndeterminate());
    }

    @Test
    void invalidInputIsRejectedBeforeAnyCall() {
        StubExchange stub = StubExchange.xml(APPROVED);
        GarantiPosAdapter adapter = adapter(stub);

        assertValidation(() -> adapter.payment(payment().card("4111111111111112", "A", "12", "2030", "123").build()));
        assertValidation(() -> adapter.payment(payment().card("4111111111111111", "A", "05", "2025", "123").build()));
        assertValidation(() -> adapter.payment(payment().card("4111111111111111", "A", "12", "2030", "12").build()));
        assertValidation(() -> adapter.payment(payment().amount(BigDecimal.ZERO).build()));
        assertValidation(() -> adapter.payment(payment().currency("JPY").build()));
        assertValidation(() -> adapter.payment(payment().installmentCount(0).build()));
        assertValidation(() -> adapter.payment(payment().orderId(" ").build()));

        assertTrue(stub.requests().isEmpty());
    }

    @Test
    void currentMonthExpiryIsAccepted() {
        PaymentResponse response = adapter(StubExchange.xml(APPROVED))
                .payment(payment().card("4111111111111111", "A", "06", "25", "123").build());

        assertTrue(response.success());
    }

    @Test
    void threeDFormPostsToGateWithRedirectUrls() {
        StubExchange stub = StubExchange.xml(APPROVED);
        PaymentRequest request = payment()
                .successUrl("https://shop.example.com/ok")
                .failUrl("https://shop.example.com/fail")
                .build();

        PaymentResponse response = adapter(stub).payment3D(request);

        String html = response.htmlContent();
        assertTrue(response.success());
        assertNull(response.transactionId());
        assertTrue(html.contains("action=\"https://garanti.test/servlet/gt3dengine\""));
        assertTrue(html.contains("name=\"successurl\" value=\"https://shop.example.com/ok\""));
        assertTrue(html.contains("name=\"errorurl\" value=\"https://shop.example.com/fail\""));
        assertTrue(html.contains("name=\"txnamount\" value=\"1050\""));
        assertTrue(html.contains("name=\"secure3dhash\" value=\"A8CE37E5C41469A4C506F0F97CFAF97C22410DB6\""));
        assertTrue(stub.requests().isEmpty());
    }

    @Test
    void threeDFormFallsBackToCallbackBaseUrl() {
        String html = adapter(StubExchange.xml(APPROVED)).payment3D(payment().build()).htmlContent();

        assertTrue(html.contains("value=\"https://shop.example.com/payment/3d/success\""));
        assertTrue(html.contains("value=\"https://shop.example.com/payment/3d/fail\""));
    }

    @Test
    void installmentIsTwoDigitsOrEmpty() {
        assertEquals("", GarantiPosAdapter.installment(1));
        assertEquals("03", GarantiPosAdapter.installment(3));
        assertEquals("12", GarantiPosAdapter.installment(12));
    }

    @Test
    void refundAndCancelAreNormalized() {
        GarantiPosAdapter adapter = adapter(StubExchange.xml(APPROVED));

        RefundResponse refund = adapter.refund(new RefundRequest("516610237283", "ORDER123",
                new BigDecimal("5.00"), "TRY", "customer request"));
        CancelResponse cancel = adapter.cancel(new CancelRequest("516610237283", "ORDER123", "304919"));

        assertTrue(refund.success());
        assertEquals("516610237283", refund.transactionId());
        assertEquals(new BigDecimal("5.00"), refund.amount());
        assertTrue(cancel.success());
    }

    @Test
    void refundWithoutOriginalTransactionIsRejected() {
        StubExchange stub = StubExchange.xml(APPROVED);

        assertValidation(() -> adapter(stub).refund(new RefundRequest(null, "ORDER123", null, null, null)));
        assertValidation(() -> adapter(stub).cancel(new CancelRequest("516610237283", "", null)));
        assertTrue(stub.requests().isEmpty());
    }

    @Test
    void authenticCallbackIsAccepted() {
        assertTrue(adapter(StubExchange.xml(APPROVED)).verifyCallback(CallbackData.of(callback("1", "Y"))));
    }

    @Test
    void badRequestWithGvpsBodyIsADecline() {
        String rejected = "<GVPSResponse><Transaction><Response><Code>92</Code>"
                + "<ErrorMsg></ErrorMsg><SysErrMsg>HASH MISMATCH</SysErrMsg></Response></Transaction></GVPSResponse>";
        StubExchange stub = StubExchange.respond(HttpStatus.BAD_REQUEST, MediaType.TEXT_XML, rejected);

        PaymentResponse response = adapter(stub).payment(payment().build());

        assertFalse(response.success());
        assertEquals("92", response.errorCode());
        assertEquals("HASH MISMATCH", response.errorMessage());
        assertEquals(rejected, response.rawResponse());
    }

    @Test
    void clientErrorWithoutGvpsBodyIsHttpError() {
        StubExchange stub = StubExchange.respond(HttpStatus.NOT_FOUND, MediaType.TEXT_HTML, "<html>Not Found</html>");

        VirtualPosException ex = assertThrows(VirtualPosException.class, () -> adapter(stub).payment(payment().build()));

        assertEquals(VirtualPosErrorType.HTTP_ERROR, ex.getType());
        assertEquals(Integer.valueOf(404), ex.getHttpStatus());
        assertFalse(ex.isOutcomeIndeterminate());
    }

    @Test
    void callbackSignedForAnotherTerminalIsRejected() {
        Map<String, String> fields = callback("1", "Y", "30691299");

        assertFalse(adapter(StubExchange.xml(APPROVED)).verifyCallback(CallbackData.of(fields)));
    }

    @Test
    void tamperedCallbackIsRejected() {
        Map<String, String> fields = callback("1", "Y");
        fields.put("txnamount", "100");

        assertFalse(adapter(StubExchange.xml(APPROVED)).verifyCallback(CallbackData.of(fields)));
    }

    @Test
    void partialAuthenticationIsRejectedEvenWhenSigned() {
        GarantiPosAdapter adapter = adapter(StubExchange.xml(APPROVED));

        assertFalse(adapter.verifyCallback(CallbackData.of(callback("4", "Y"))));
        assertFalse(adapter.verifyCallback(CallbackData.of(callback("0", "Y"))));
        assertFalse(adapter.verifyCallback(CallbackData.of(callback("1", "N"))));
    }

    @Test
    void incompleteCallbackIsRejected() {
        Map<String, String> fields = callback("1", "Y");
        fields.remove("hashdata");

        assertFalse(adapter(StubExchange.xml(APPROVED)).verifyCallback(CallbackData.of(fields)));
        assertFalse(adapter(StubExchange.xml(APPROVED)).verifyCallback(null));
    }

    @Test
    void missingCredentialFailsConstruction() {
        BankAdapterConfig noPassword = new BankAdapterConfig(BankCode.GARANTI, "7000679", "30691298", "PROVAUT",
                null, "12345678", "https://garanti.test/VPServlet", "https://garanti.test/gt3dengine", true, null);

        VirtualPosException ex = assertThrows(VirtualPosException.class,
                () -> new GarantiPosAdapter(noPassword, StubExchange.xml(APPROVED).webClient(), Duration.ofSeconds(1), CLOCK));

        assertEquals(VirtualPosErrorType.CONFIGURATION, ex.getType());
    }

    private static Map<String, String> callback(String mdStatus, String txnStatus) {
        return callback(mdStatus, txnStatus, "30691298");
    }

    private static Map<String, String> callback(String mdStatus, String txnStatus, String terminalId) {
        String hash = new GarantiSignatureEngine(CONFIG).computeSignature(OperationType.CALLBACK,
                SignatureInput.builder()
                        .orderId("ORDER123")
                        .terminalId(terminalId)
                        .echoedAmount("1050")
                        .transactionStatus(txnStatus)
                        .mdStatus(mdStatus)
                        .build());
        Map<String, String> fields = new HashMap<>();
        fields.put("orderid", "ORDER123");
        fields.put("terminalid", terminalId);
        fields.put("txnamount", "1050");
        fields.put("txnstatus", txnStatus);
        fields.put("mdstatus", mdStatus);
        fields.put("hashdata", hash);
        fields.put("procreturncode", "00");
        return fields;
    }

    private static void assertValidation(Executable call) {
        VirtualPosException ex = assertThrows(VirtualPosException.class, call);
        assertEquals(VirtualPosErrorType.VALIDATION, ex.getType());
        assertFalse(ex.isOutcomeIndeterminate());
    }
}
