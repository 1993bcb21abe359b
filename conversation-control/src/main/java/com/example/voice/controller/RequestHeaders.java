package com.example.voice.controller;

public final class RequestHeaders {

    public static final String ORGANIZATION_ID = "X-Organization-Id";

    private RequestHeaders() {}
}
