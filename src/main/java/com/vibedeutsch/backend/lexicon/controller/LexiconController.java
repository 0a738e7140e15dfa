package com.vibedeutsch.backend.lexicon.controller;

import com.vibedeutsch.backend.lexicon.dto.ResolveResponse;
import com.vibedeutsch.backend.lexicon.dto.SenseCorrectionRequest;
import com.vibedeutsch.backend.lexicon.match.ResolverProperties;
import com.vibedeutsch.backend.lexicon.nlp.TextNorm;
import com.vibedeutsch.backend.lexicon.service.LexiconCurationService;
import com.vibedeutsch.backend.lexicon.service.LexiconResolutionService;
import com.vibedeutsch.backend.lexicon.service.ResolutionResult;
import com.vibedeutsch.backend.lexicon.store.LexiconEntry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/lexicon")
public class LexiconController {

    private final LexiconResolutionService resolutionService;
    private final LexiconCurationService curationService;
    private final ResolverProperties resolverProps;

    @GetMapping("/resolve")
    public ResponseEntity<ResolveResponse> resolve(@RequestParam("q") String q) {
        if (TextNorm.codePointLength(q) > resolverProps.getMaxQueryLength()) {
            throw new IllegalArgumentException("QUERY_TOO_LONG");
        }
        ResolutionResult r = resolutionService.resolve(q);
        HttpStatus status = (r instanceof ResolutionResult.TransientFailure)
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(ResolveResponse.from(r));
    }

    @PatchMapping("/senses/{senseId}")
    public LexiconEntry correctSense(@PathVariable Long senseId,
                                     @Valid @RequestBody SenseCorrectionRequest req) {
        return curationService.correctSense(senseId, req.pos(), req.gender());
    }
}
