package com.netwarden.backend.geoip.provider;

import lombok.Getter;

@Getter
public class GeoIpParseException extends RuntimeException {

    private final String code;
    private final String bodySnippet;

    public GeoIpParseException(String code, String message, String bodySnippet, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.bodySnippet = bodySnippet;
    }

}
