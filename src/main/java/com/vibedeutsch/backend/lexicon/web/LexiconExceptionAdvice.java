package com.vibedeutsch.backend.lexicon.web;

import com.vibedeutsch.backend.common.web.RequestIdFilter;
import com.vibedeutsch.backend.lexicon.controller.LexiconController;
import com.vibedeutsch.backend.lexicon.dto.LexiconErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(assignableTypes = LexiconController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class LexiconExceptionAdvice {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<LexiconErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        HttpStatus status = switch (code) {
            case "SENSE_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "SENSE_LOCKED" -> HttpStatus.CONFLICT;
            case "QUERY_TOO_LONG", "CORRECTION_EMPTY", "GENDER_INVALID" -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status)
                .body(new LexiconErrorResponse(code, e.getMessage(), RequestIdFilter.getOrCreate(req)));
    }

    private static String norm(String s, String fallback) {
        return (s == null || s.isBlank()) ? fallback : s.trim();
    }
}
