package com.bikerental.planner.api;

import com.bikerental.planner.error.EmptyCatalogException;
import com.bikerental.planner.error.PlanningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class PlanningExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(PlanningExceptionHandler.class);

    @ExceptionHandler(PlanningException.class)
    public ResponseEntity<Map<String, Object>> handlePlanning(PlanningException ex) {
        log.warn("plan.rejected code={} message={}", ex.code(), ex.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", ex.code());
        body.put("message", ex.getMessage());
        if (ex instanceof EmptyCatalogException empty && empty.diagnostics() != null) {
            body.put("emptyReason", empty.diagnostics().emptyReason());
            body.put("catalogSize", empty.diagnostics().catalogSize());
            body.put("availableCount", empty.diagnostics().availableCount());
        }
        return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
    }
}
