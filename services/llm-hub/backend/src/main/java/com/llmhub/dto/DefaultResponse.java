package com.llmhub.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * /api/** 공통 응답 봉투
 * - 성공: data 만 채움
 * - 실패: error 만 채움 (GlobalExceptionHandler)
 */
@Getter
@AllArgsConstructor
public class DefaultResponse<T> {

    private int httpCode;
    private T data;
    private ErrorResponse error;

    public static <T> DefaultResponse<T> success(int httpCode, T data) {
        return new DefaultResponse<>(httpCode, data, null);
    }

    public static DefaultResponse<Void> failure(int httpCode, String code, String message) {
        return new DefaultResponse<>(
                httpCode,
                null,
                new ErrorResponse(code, message)
        );
    }
}
