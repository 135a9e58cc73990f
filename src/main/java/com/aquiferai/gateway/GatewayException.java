package com.aquiferai.gateway;

import lombok.Getter;

@Getter
public class GatewayException extends RuntimeException {

    private final ModelRole role;

    public GatewayException(ModelRole role, String message) {
        super(message);
        this.role = role;
    }

    public GatewayException(ModelRole role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }
}
