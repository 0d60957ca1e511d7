package com.keystone.dispatch.api;

public record CancelRequest(String reason) {}
