package com.evidex.api.dto;

public record FlagRequest(String reason) {
}
