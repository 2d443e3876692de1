package org.bump.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.bump.dto.AttachRequest;
import org.bump.error.Result;
import org.bump.error.Results;
import org.bump.security.CurrentUser;
import org.bump.sync.SyncPoller;
import org.bump.sync.SyncSnapshot;
import org.bump.sync.SyncSources;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * Abonnements par polling : le client attache une table, lit l'instantané à son rythme puis détache.
 * Un abonnement que plus personne ne lit est détaché par le poller.
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncPoller poller;
    private final SyncSources sources;
    private final CurrentUser currentUser;

    @PostMapping
    public ResponseEntity<Result<SyncSnapshot>> attach(@Valid @RequestBody AttachRequest body, Authentication auth) {
        Long viewerId = currentUser.idOf(auth);
        return ResultResponses.created(Results.capture("attach", () -> poller.lease(
                viewerId,
                sources.resolve(body.getTable(), body.getFilter(), body.getFilterValue(), viewerId),
                body.getIntervalMs()).snapshot()));
    }

    @GetMapping("/{handle}")
    public ResponseEntity<Result<SyncSnapshot>> snapshot(@PathVariable String handle, Authentication auth) {
        Long viewerId = currentUser.idOf(auth);
        return ResultResponses.of(Results.capture("snapshot", () -> poller.find(handle, viewerId).snapshot()));
    }

    @DeleteMapping("/{handle}")
    public ResponseEntity<Result<Void>> detach(@PathVariable String handle, Authentication auth) {
        Long viewerId = currentUser.idOf(auth);
        return ResultResponses.of(Results.run("detach", () -> poller.detach(handle, viewerId)));
    }
}
