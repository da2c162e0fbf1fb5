package com.netwarden.backend.geoip.provider;

import lombok.Getter;

@Getter
public class GeoIpHttpException extends RuntimeException {

    private final int status;
    private final String bodySnippet;

    public GeoIpHttpException(int status, String message, String bodySnippet) {
        super(message);
        this.status = status;
        this.bodySnippet = bodySnippet;
    }

}
