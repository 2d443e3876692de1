package org.bump.sync;

import lombok.RequiredArgsConstructor;
import org.bump.dto.CheckInView;
import org.bump.dto.ProfileSummary;
import org.bump.dto.RelationshipView;
import org.bump.error.ValidationException;
import org.bump.model.Relationship;
import org.bump.repo.RelationshipRepository;
import org.bump.service.Hydrator;
import org.bump.service.PresenceService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Tables pouvant être suivies par le poller, toujours restreintes à ce que l'appelant peut voir.
 * Le filtre optionnel est une égalité sur une colonne de la table.
 */
@Component
@RequiredArgsConstructor
public class SyncSources {

    public static final String RELATIONSHIPS = "relationships";
    public static final String PRESENCE = "presence";

    private static final Map<String, Function<Relationship, Object>> RELATIONSHIP_COLUMNS = Map.of(
            "status", Relationship::getStatus,
            "requester_id", Relationship::getRequesterId,
            "recipient_id", Relationship::getRecipientId);

    private static final Map<String, Function<CheckInView, Object>> PRESENCE_COLUMNS = Map.of(
            "subject_id", CheckInView::getSubjectId,
            "place_id", CheckInView::getPlaceId,
            "privacy", CheckInView::getPrivacy);

    private final RelationshipRepository relationshipRepo;
    private final Hydrator hydrator;
    private final PresenceService presenceService;

    public Callable<List<?>> resolve(String table, String filter, String filterValue, Long viewerId) {
        if (RELATIONSHIPS.equals(table)) {
            Function<Relationship, Object> column = column(RELATIONSHIP_COLUMNS, table, filter);
            return () -> views(filtered(relationshipRepo.findParticipating(viewerId), column, filterValue), viewerId);
        }
        if (PRESENCE.equals(table)) {
            Function<CheckInView, Object> column = column(PRESENCE_COLUMNS, table, filter);
            return () -> filtered(presenceService.listVisible(viewerId).orElseThrow(), column, filterValue);
        }
        throw new ValidationException("Table inconnue : " + table);
    }

    // Même forme que GET /api/relationships : l'autre partie hydratée
    private List<RelationshipView> views(List<Relationship> rows, Long viewerId) {
        Map<Long, ProfileSummary> profiles = hydrator.profiles(
                rows.stream().map(r -> r.counterpartOf(viewerId)).toList());
        return rows.stream()
                .map(r -> RelationshipView.of(r, profiles.get(r.counterpartOf(viewerId))))
                .toList();
    }

    private static <R> Function<R, Object> column(Map<String, Function<R, Object>> columns, String table, String filter) {
        if (filter == null || filter.isBlank()) return null;
        Function<R, Object> f = columns.get(filter);
        if (f == null) {
            throw new ValidationException("Colonne inconnue pour " + table + " : " + filter);
        }
        return f;
    }

    // Comparaison sur la forme texte, insensible à la casse (les enums arrivent en minuscules côté client)
    private static <R> List<R> filtered(List<R> rows, Function<R, Object> column, String value) {
        if (column == null || value == null) return rows;
        return rows.stream()
                .filter(r -> {
                    Object v = column.apply(r);
                    return v != null && String.valueOf(v).equalsIgnoreCase(value);
                })
                .toList();
    }
}
