package com.signalrelay.backend.service;

import com.signalrelay.backend.dto.GatewayResponse;

public record GatewayResult(int httpStatus, GatewayResponse body) {
}
