package com.example.finance.fincheck.controller;

import com.example.finance.fincheck.validation.record.RecordValidationService;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final RecordValidationService recordValidationService;

    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        List<String> recordTypes = recordValidationService.names().stream().sorted().toList();
        return Mono.just(ResponseEntity.ok(Map.of("status", "up", "recordTypes", recordTypes)));
    }
}
