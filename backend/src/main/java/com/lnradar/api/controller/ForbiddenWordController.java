package com.lnradar.api.controller;

import com.lnradar.api.config.AdminProperties;
import com.lnradar.api.dto.ErrorBody;
import com.lnradar.api.dto.ForbiddenWordRequest;
import com.lnradar.api.dto.ForbiddenWordResponse;
import com.lnradar.ingestion.filter.ForbiddenWordService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Administrative forbidden-word management. Guarded by {@code X-Admin-Token} when lnradar.admin.token is set.
 */
@RestController
@RequestMapping("/api/admin/forbidden-words")
@RequiredArgsConstructor
public class ForbiddenWordController {

    static final String TOKEN_HEADER = "X-Admin-Token";

    private final ForbiddenWordService forbiddenWordService;
    private final AdminProperties adminProperties;

    @GetMapping
    public ResponseEntity<?> list(@RequestHeader(name = TOKEN_HEADER, required = false) String token) {
        if (!authorized(token)) {
            return unauthorized();
        }
        return ResponseEntity.ok(forbiddenWordService.words());
    }

    @PostMapping
    public ResponseEntity<?> add(@RequestHeader(name = TOKEN_HEADER, required = false) String token,
                                 @RequestBody @Valid ForbiddenWordRequest request) {
        if (!authorized(token)) {
            return unauthorized();
        }
        boolean added = forbiddenWordService.addWord(request.word(), request.resanitize());
        return ResponseEntity.ok(new ForbiddenWordResponse(added, request.resanitize(), forbiddenWordService.words()));
    }

    private boolean authorized(String token) {
        if (!adminProperties.isTokenRequired()) {
            return true;
        }
        if (token == null) {
            return false;
        }
        return MessageDigest.isEqual(
                adminProperties.getToken().getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8));
    }

    private static ResponseEntity<ErrorBody> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ErrorBody.of("UNAUTHORIZED", "Missing or invalid " + TOKEN_HEADER));
    }
}
