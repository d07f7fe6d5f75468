package com.tony.footValue.model.dto;

public record ApiError(String code, String message, String path) {
}
