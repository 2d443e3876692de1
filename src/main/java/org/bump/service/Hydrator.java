package org.bump.service;

import lombok.RequiredArgsConstructor;
import org.bump.dto.PlaceDto;
import org.bump.dto.ProfileSummary;
import org.bump.model.Place;
import org.bump.model.Utilisateur;
import org.bump.repo.PlaceRepository;
import org.bump.repo.UtilisateurRepository;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

/**
 * Jointures en lecture seule vers les profils et les lieux, chargés par lot
 * pour éviter une requête par ligne.
 */
@Component
@RequiredArgsConstructor
public class Hydrator {

    private final UtilisateurRepository utilisateurRepo;
    private final PlaceRepository placeRepo;

    public Map<Long, ProfileSummary> profiles(Collection<Long> ids) {
        Map<Long, ProfileSummary> out = new HashMap<>();
        if (ids.isEmpty()) return out;
        for (Utilisateur u : utilisateurRepo.findAllById(new HashSet<>(ids))) {
            out.put(u.getId(), ProfileSummary.of(u));
        }
        return out;
    }

    public Map<Long, PlaceDto> places(Collection<Long> ids) {
        Map<Long, PlaceDto> out = new HashMap<>();
        if (ids.isEmpty()) return out;
        for (Place p : placeRepo.findAllById(new HashSet<>(ids))) {
            out.put(p.getId(), PlaceDto.of(p));
        }
        return out;
    }
}
