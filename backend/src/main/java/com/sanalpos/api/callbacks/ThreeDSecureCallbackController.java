/*
 * Copyright (C) 2025 SanalPos Gateway
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.sanalpos.api.callbacks;

import com.sanalpos.api.ApiException;
import com.sanalpos.application.VirtualPosGateway;
import com.sanalpos.domain.model.BankCode;
import com.sanalpos.infrastructure.pos.CallbackData;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives the browser redirect a bank issues after 3D Secure authentication and reports whether
 * it is authentic. Settling the order is left to the caller.
 */
@RestController
@RequestMapping("/api/pos")
public class ThreeDSecureCallbackController {
    private final VirtualPosGateway gateway;

    public ThreeDSecureCallbackController(VirtualPosGateway gateway) {
        this.gateway = gateway;
    }

    @PostMapping(value = "/{bank}/callback",
            consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public CallbackResult callback(@PathVariable("bank") String bankName, @RequestParam Map<String, String> fields) {
        BankCode bank = gateway.resolveBank(bankName);
        if (fields.isEmpty()) {
            throw new ApiException(HttpStatus.BAD_REQUEST, "Callback carried no fields");
        }
        CallbackData data = CallbackData.of(fields);
        boolean verified = gateway.verifyCallback(bank, data);
        return new CallbackResult(bank, orderId(data), verified);
    }

    private static String orderId(CallbackData data) {
        for (String key : new String[]{"orderid", "oid"}) {
            if (data.has(key)) return data.get(key);
        }
        return null;
    }

    public record CallbackResult(BankCode bank, String orderId, boolean verified) {}
}
