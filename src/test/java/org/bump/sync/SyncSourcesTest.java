package org.bump.sync;

import org.bump.dto.CheckInView;
import org.bump.dto.ProfileSummary;
import org.bump.dto.RelationshipView;
import org.bump.error.BumpException;
import org.bump.error.ErrorKind;
import org.bump.error.Result;
import org.bump.error.ValidationException;
import org.bump.model.Privacy;
import org.bump.model.Relationship;
import org.bump.repo.RelationshipRepository;
import org.bump.service.Hydrator;
import org.bump.service.PresenceService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncSourcesTest {

    @Mock
    private RelationshipRepository relationshipRepo;

    @Mock
    private Hydrator hydrator;

    @Mock
    private PresenceService presenceService;

    @InjectMocks
    private SyncSources sources;

    private Relationship row(long id, long requester, long recipient, Relationship.Status status) {
        Relationship r = Relationship.propose(requester, recipient, Instant.parse("2026-10-19T10:00:00Z"));
        r.setId(id);
        r.setStatus(status);
        return r;
    }

    @Test
    void resolve_unknownTable_shouldFailValidation() {
        assertThatThrownBy(() -> sources.resolve("settings", null, null, 1L))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void resolve_unknownColumn_shouldFailValidation() {
        assertThatThrownBy(() -> sources.resolve("relationships", "hope_to_bump", "true", 1L))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(relationshipRepo);
    }

    @Test
    void relationships_shouldBeScopedToViewerAndFilteredByEquality() throws Exception {
        when(relationshipRepo.findParticipating(1L)).thenReturn(List.of(
                row(1L, 1L, 2L, Relationship.Status.PENDING),
                row(2L, 3L, 1L, Relationship.Status.ACCEPTED)));

        when(hydrator.profiles(List.of(2L))).thenReturn(Map.of(2L, new ProfileSummary(2L, "bobby", "Bob")));

        List<?> rows = sources.resolve("relationships", "status", "pending", 1L).call();

        assertThat(rows).hasSize(1);
        RelationshipView view = (RelationshipView) rows.get(0);
        assertThat(view.getId()).isEqualTo(1L);
        assertThat(view.getStatus()).isEqualTo(Relationship.Status.PENDING);
        assertThat(view.getCounterpart().getPseudo()).isEqualTo("bobby");
    }

    @Test
    void relationships_withoutFilter_shouldReturnAllRowsOfViewer() throws Exception {
        when(relationshipRepo.findParticipating(1L)).thenReturn(List.of(
                row(1L, 1L, 2L, Relationship.Status.PENDING),
                row(2L, 3L, 1L, Relationship.Status.ACCEPTED)));

        when(hydrator.profiles(List.of(2L, 3L))).thenReturn(Map.of(
                2L, new ProfileSummary(2L, "bobby", "Bob"),
                3L, new ProfileSummary(3L, "carol", "Carol")));

        List<?> rows = sources.resolve("relationships", null, null, 1L).call();

        assertThat(rows).hasSize(2);
        for (Object r : rows) {
            assertThat(r).isInstanceOf(RelationshipView.class);
        }
        assertThat(((RelationshipView) rows.get(1)).getCounterpart().getPseudo()).isEqualTo("carol");
    }

    @Test
    void presence_shouldUseVisibleCheckIns() throws Exception {
        CheckInView pub = CheckInView.builder().id(1L).subjectId(2L).placeId(7L).privacy(Privacy.PUBLIC).build();
        CheckInView friends = CheckInView.builder().id(2L).subjectId(3L).placeId(7L).privacy(Privacy.FRIENDS).build();
        when(presenceService.listVisible(1L)).thenReturn(Result.ok(List.of(pub, friends)));

        List<?> rows = sources.resolve("presence", "privacy", "public", 1L).call();

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).isSameAs(pub);
    }

    @Test
    void presence_whenEngineFails_shouldThrowSoPollerSetsError() {
        when(presenceService.listVisible(1L)).thenReturn(Result.fail(ErrorKind.STORE, "down"));

        assertThatThrownBy(() -> sources.resolve("presence", null, null, 1L).call())
                .isInstanceOf(BumpException.class);
    }
}
