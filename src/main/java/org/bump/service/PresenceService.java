package org.bump.service;

import lombok.extern.slf4j.Slf4j;
import org.bump.dto.*;
import org.bump.error.*;
import org.bump.model.CheckIn;
import org.bump.model.Privacy;
import org.bump.repo.CheckInRepository;
import org.bump.repo.PlaceRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Check-ins : création, expiration (TTL ou manuelle), regroupement par lieu et visibilité.
 */
@Slf4j
@Service
public class PresenceService {

    static final String DEFAULT_ACTIVITY = "Hanging out";
    static final int MAX_ACTIVITY_LENGTH = 140;

    private final CheckInRepository checkInRepo;
    private final PlaceRepository placeRepo;
    private final RelationshipService relationshipService;
    private final Hydrator hydrator;
    private final Clock clock;
    private final Duration defaultTtl;

    public PresenceService(CheckInRepository checkInRepo,
                           PlaceRepository placeRepo,
                           RelationshipService relationshipService,
                           Hydrator hydrator,
                           Clock clock,
                           @Value("${bump.presence.default-ttl-minutes:120}") long defaultTtlMinutes) {
        this.checkInRepo = checkInRepo;
        this.placeRepo = placeRepo;
        this.relationshipService = relationshipService;
        this.hydrator = hydrator;
        this.clock = clock;
        this.defaultTtl = Duration.ofMinutes(defaultTtlMinutes);
    }

    public Result<CheckInView> createCheckIn(Long subjectId, CheckInRequest req) {
        return Results.capture("createCheckIn", () -> {
            if (subjectId == null) {
                throw new ValidationException("Utilisateur courant manquant");
            }
            if (req == null || req.getPlaceId() == null) {
                throw new ValidationException("Lieu manquant");
            }
            Instant now = clock.instant();
            if (req.getExpiresAt() != null && !req.getExpiresAt().isAfter(now)) {
                throw new ValidationException("La date d'expiration doit être dans le futur");
            }
            if (!placeRepo.existsById(req.getPlaceId())) {
                throw new NotFoundException("Lieu introuvable");
            }

            CheckIn c = new CheckIn();
            c.setSubjectId(subjectId);
            c.setPlaceId(req.getPlaceId());
            c.setActivity(normalizeActivity(req.getActivity()));
            c.setPrivacy(req.getPrivacy() != null ? req.getPrivacy() : Privacy.FRIENDS);
            c.setCreatedAt(now);
            c.setExpiresAt(req.getExpiresAt() != null ? req.getExpiresAt() : now.plus(defaultTtl));

            CheckIn saved = checkInRepo.save(c);
            log.info("Check-in {} de {} au lieu {} jusqu'à {}", saved.getId(), subjectId, saved.getPlaceId(), saved.getExpiresAt());
            return hydrate(List.of(saved)).get(0);
        });
    }

    /** Tous les check-ins actifs, plus récents d'abord. */
    public Result<List<CheckInView>> listActive() {
        return Results.capture("listActive", () -> hydrate(checkInRepo.findActive(clock.instant())));
    }

    public Result<List<PlaceCheckIns>> groupByPlace() {
        return Results.capture("groupByPlace", () -> group(hydrate(checkInRepo.findActive(clock.instant()))));
    }

    /**
     * Check-ins actifs que {@code viewerId} a le droit de voir : les siens, les publics,
     * et ceux « amis » de ses amis acceptés.
     */
    public Result<List<CheckInView>> listVisible(Long viewerId) {
        return Results.capture("listVisible", () -> hydrate(visibleTo(viewerId)));
    }

    public Result<List<PlaceCheckIns>> groupVisibleByPlace(Long viewerId) {
        return Results.capture("groupVisibleByPlace", () -> group(hydrate(visibleTo(viewerId))));
    }

    public Result<CheckInView> updateCheckIn(Long checkInId, Long subjectId, CheckInUpdate patch) {
        return Results.capture("updateCheckIn", () -> {
            CheckIn c = loadOwned(checkInId, subjectId);
            Instant now = clock.instant();
            // expiré = définitif
            if (!c.isActiveAt(now)) {
                throw new ValidationException("Ce check-in a expiré");
            }
            if (patch == null) {
                return hydrate(List.of(c)).get(0);
            }
            if (patch.getExpiresAt() != null && !patch.getExpiresAt().isAfter(now)) {
                throw new ValidationException("La date d'expiration doit être dans le futur");
            }
            if (patch.getActivity() != null) {
                c.setActivity(normalizeActivity(patch.getActivity()));
            }
            if (patch.getPrivacy() != null) {
                c.setPrivacy(patch.getPrivacy());
            }
            if (patch.getExpiresAt() != null) {
                c.setExpiresAt(patch.getExpiresAt());
            }
            return hydrate(List.of(checkInRepo.save(c))).get(0);
        });
    }

    // Suppression douce : on garde la ligne pour l'historique
    public Result<CheckInView> expireCheckIn(Long checkInId, Long subjectId) {
        return Results.capture("expireCheckIn", () -> {
            CheckIn c = loadOwned(checkInId, subjectId);
            Instant now = clock.instant();
            if (!c.isActiveAt(now)) {
                return hydrate(List.of(c)).get(0);
            }
            c.expire(now);
            CheckIn saved = checkInRepo.save(c);
            log.info("Check-in {} expiré par {}", saved.getId(), subjectId);
            return hydrate(List.of(saved)).get(0);
        });
    }

    /** Historique complet d'un utilisateur, expirés compris. */
    public Result<List<CheckInView>> history(Long subjectId) {
        return Results.capture("history", () -> hydrate(checkInRepo.findBySubjectIdOrderByCreatedAtDescIdDesc(subjectId)));
    }

    private List<CheckIn> visibleTo(Long viewerId) {
        List<CheckIn> active = checkInRepo.findActive(clock.instant());
        Set<Long> friends = null;
        List<CheckIn> out = new ArrayList<>();
        for (CheckIn c : active) {
            if (c.getSubjectId().equals(viewerId) || c.getPrivacy() == Privacy.PUBLIC) {
                out.add(c);
            } else if (c.getPrivacy() == Privacy.FRIENDS) {
                if (friends == null) {
                    friends = relationshipService.friendIdsOf(viewerId);
                }
                if (friends.contains(c.getSubjectId())) {
                    out.add(c);
                }
            }
        }
        return out;
    }

    // Ordre des lieux = premier vu ; ordre interne = ordre de lecture
    private List<PlaceCheckIns> group(List<CheckInView> views) {
        Map<Long, PlaceCheckIns> byPlace = new LinkedHashMap<>();
        for (CheckInView v : views) {
            byPlace.computeIfAbsent(v.getPlaceId(), id -> new PlaceCheckIns(v.getPlace(), new ArrayList<>()))
                    .getCheckIns()
                    .add(v);
        }
        return new ArrayList<>(byPlace.values());
    }

    private List<CheckInView> hydrate(List<CheckIn> rows) {
        Map<Long, PlaceDto> places = hydrator.places(rows.stream().map(CheckIn::getPlaceId).toList());
        Map<Long, ProfileSummary> profiles = hydrator.profiles(rows.stream().map(CheckIn::getSubjectId).toList());
        return rows.stream()
                .map(c -> CheckInView.of(c, places.get(c.getPlaceId()), profiles.get(c.getSubjectId())))
                .toList();
    }

    private CheckIn loadOwned(Long checkInId, Long subjectId) {
        if (checkInId == null) {
            throw new ValidationException("Check-in manquant");
        }
        CheckIn c = checkInRepo.findById(checkInId)
                .orElseThrow(() -> new NotFoundException("Check-in introuvable"));
        if (!c.getSubjectId().equals(subjectId)) {
            throw new NotAuthorizedException("Ce check-in ne vous appartient pas");
        }
        return c;
    }

    private String normalizeActivity(String activity) {
        if (activity == null || activity.isBlank()) {
            return DEFAULT_ACTIVITY;
        }
        String trimmed = activity.trim();
        if (trimmed.length() > MAX_ACTIVITY_LENGTH) {
            throw new ValidationException("Activité trop longue (140 caractères max)");
        }
        return trimmed;
    }
}
