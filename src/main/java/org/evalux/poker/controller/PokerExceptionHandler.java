package org.evalux.poker.controller;

import lombok.extern.slf4j.Slf4j;
import org.evalux.poker.service.poker.error.InsufficientBalanceException;
import org.evalux.poker.service.poker.error.PersistenceFailureException;
import org.evalux.poker.service.poker.error.PokerValidationException;
import org.evalux.poker.service.poker.error.RestorationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice(assignableTypes = PokerTableController.class)
public class PokerExceptionHandler {

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<Map<String, Object>> insufficient(InsufficientBalanceException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("required", e.getRequired());
        body.put("available", e.getAvailable());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(PokerValidationException.class)
    public ResponseEntity<Map<String, Object>> validation(PokerValidationException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalidBody(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getDefaultMessage() == null ? f.getField() : f.getDefaultMessage())
                .findFirst().orElse("Requête invalide");
        return ResponseEntity.badRequest().body(Map.of("error", msg));
    }

    // contention sur le verrou de ligne : le client peut réessayer
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> conflict(PessimisticLockingFailureException e) {
        log.info("Contention sur la main active: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Table occupée, réessaie"));
    }

    @ExceptionHandler({PersistenceFailureException.class, RestorationException.class})
    public ResponseEntity<Map<String, Object>> unavailable(RuntimeException e) {
        log.error("Table indisponible", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
    }
}
