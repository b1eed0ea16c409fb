package com.evidex.api.dto;

public record NoteRequest(String note) {
}
