package org.bump.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.bump.dto.*;
import org.bump.error.Result;
import org.bump.security.CurrentUser;
import org.bump.service.PresenceService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/checkins")
@RequiredArgsConstructor
public class CheckInController {

    private final PresenceService service;
    private final CurrentUser currentUser;

    // Check-ins actifs visibles par l'appelant
    @GetMapping
    public ResponseEntity<Result<List<CheckInView>>> active(Authentication auth) {
        return ResultResponses.of(service.listVisible(currentUser.idOf(auth)));
    }

    @GetMapping("/by-place")
    public ResponseEntity<Result<List<PlaceCheckIns>>> byPlace(Authentication auth) {
        return ResultResponses.of(service.groupVisibleByPlace(currentUser.idOf(auth)));
    }

    @GetMapping("/mine")
    public ResponseEntity<Result<List<CheckInView>>> mine(Authentication auth) {
        return ResultResponses.of(service.history(currentUser.idOf(auth)));
    }

    @PostMapping
    public ResponseEntity<Result<CheckInView>> create(@Valid @RequestBody CheckInRequest body, Authentication auth) {
        return ResultResponses.created(service.createCheckIn(currentUser.idOf(auth), body));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Result<CheckInView>> update(@PathVariable Long id,
                                                      @Valid @RequestBody CheckInUpdate body,
                                                      Authentication auth) {
        return ResultResponses.of(service.updateCheckIn(id, currentUser.idOf(auth), body));
    }

    // Expiration immédiate, la ligne reste dans l'historique
    @DeleteMapping("/{id}")
    public ResponseEntity<Result<CheckInView>> expire(@PathVariable Long id, Authentication auth) {
        return ResultResponses.of(service.expireCheckIn(id, currentUser.idOf(auth)));
    }
}
