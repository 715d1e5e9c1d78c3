package com.vaultpost.keys;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyExchangeResult(boolean success, String publicKey) {

    public static KeyExchangeResult success(String publicKey) {
        return new KeyExchangeResult(true, publicKey);
    }

    public static KeyExchangeResult failure() {
        return new KeyExchangeResult(false, null);
    }
}
