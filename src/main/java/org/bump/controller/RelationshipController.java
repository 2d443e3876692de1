package org.bump.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.bump.dto.*;
import org.bump.error.Result;
import org.bump.security.CurrentUser;
import org.bump.service.RelationshipService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/relationships")
@RequiredArgsConstructor
public class RelationshipController {

    private final RelationshipService service;
    private final CurrentUser currentUser;

    @GetMapping
    public ResponseEntity<Result<RelationshipLists>> list(Authentication auth) {
        return ResultResponses.of(service.listRelationships(currentUser.idOf(auth)));
    }

    // ✅ envoyer une demande
    @PostMapping
    public ResponseEntity<Result<RelationshipView>> propose(@Valid @RequestBody ProposeRequest body, Authentication auth) {
        return ResultResponses.created(service.proposeRelationship(currentUser.idOf(auth), body.getRecipientId()));
    }

    @PostMapping("/{id}/accept")
    public ResponseEntity<Result<RelationshipView>> accept(@PathVariable Long id, Authentication auth) {
        return ResultResponses.of(service.acceptRelationship(id, currentUser.idOf(auth)));
    }

    // refuser / annuler / retirer
    @DeleteMapping("/{id}")
    public ResponseEntity<Result<Void>> remove(@PathVariable Long id, Authentication auth) {
        return ResultResponses.of(service.removeRelationship(id, currentUser.idOf(auth)));
    }

    @PutMapping("/{id}/hope-to-bump")
    public ResponseEntity<Result<RelationshipView>> hopeToBump(@PathVariable Long id,
                                                               @Valid @RequestBody HopeToBumpRequest body,
                                                               Authentication auth) {
        return ResultResponses.of(service.setHopeToBump(id, currentUser.idOf(auth), body.getValue()));
    }

    @GetMapping("/candidates")
    public ResponseEntity<Result<List<ProfileSummary>>> candidates(@RequestParam(name = "q", required = false) String q,
                                                                   Authentication auth) {
        return ResultResponses.of(service.searchCandidates(q, currentUser.idOf(auth)));
    }
}
