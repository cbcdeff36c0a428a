package com.example.devopsgateway.controller;

import com.example.devopsgateway.gateway.PendingResult;
import com.example.devopsgateway.gateway.PendingResultStore;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.security.RequestAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

/**
 * Poll endpoint for the real data behind an optimistic read.
 * Only the principal that issued the read can see its result.
 */
@RestController
@RequestMapping("/api/results")
@RequiredArgsConstructor
public class ResultController {

    private final PendingResultStore resultStore;
    private final RequestAuthenticator authenticator;

    @GetMapping("/{requestId}")
    public ResponseEntity<PendingResult> getResult(@PathVariable String requestId, HttpServletRequest request) {
        Principal principal = authenticator.authenticate(request);
        return resultStore.find(requestId)
                .filter(result -> Objects.equals(result.getOwner(), principal.getUserId()))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
