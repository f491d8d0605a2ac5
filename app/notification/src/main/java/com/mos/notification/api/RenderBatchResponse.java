package com.mos.notification.api;

public record RenderBatchResponse(int rendered) {}
