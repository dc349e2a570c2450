package com.estatedesk.audit.api;

public record CountResponse(int count) {}
