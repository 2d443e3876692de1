package org.bump.controller;

import com.jayway.jsonpath.JsonPath;
import org.bump.model.Place;
import org.bump.model.Utilisateur;
import org.bump.repo.CheckInRepository;
import org.bump.repo.PlaceRepository;
import org.bump.repo.RelationshipRepository;
import org.bump.repo.UtilisateurRepository;
import org.bump.security.JwtTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class BumpFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private UtilisateurRepository utilisateurRepo;

    @Autowired
    private PlaceRepository placeRepo;

    @Autowired
    private RelationshipRepository relationshipRepo;

    @Autowired
    private CheckInRepository checkInRepo;

    private Long aliceId;
    private Long bobId;
    private Long placeId;

    private static final RequestPostProcessor ALICE = user("alice@bump.test");
    private static final RequestPostProcessor BOB = user("bob@bump.test");
    private static final RequestPostProcessor CAROL = user("carol@bump.test");

    @BeforeEach
    void setup() {
        checkInRepo.deleteAll();
        relationshipRepo.deleteAll();
        placeRepo.deleteAll();
        utilisateurRepo.deleteAll();

        aliceId = utilisateurRepo.save(Utilisateur.builder().email("alice@bump.test").pseudo("alice").nomAffiche("Alice").build()).getId();
        bobId = utilisateurRepo.save(Utilisateur.builder().email("bob@bump.test").pseudo("bobby").nomAffiche("Bob").build()).getId();
        utilisateurRepo.save(Utilisateur.builder().email("carol@bump.test").pseudo("carol").nomAffiche("Carol").build());
        placeId = placeRepo.save(Place.builder().name("Café Oberkampf").address("1 rue Oberkampf").lat(48.86).lng(2.37).build()).getId();
    }

    private long idFrom(String json) {
        return ((Number) JsonPath.read(json, "$.data.id")).longValue();
    }

    private long propose(RequestPostProcessor who, Long recipientId) throws Exception {
        String json = mockMvc.perform(post("/api/relationships").with(who)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\":" + recipientId + "}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return idFrom(json);
    }

    @Test
    void relationshipLifecycle_fromProposalToRemovalAndBack() throws Exception {
        long id = propose(ALICE, bobId);

        // en attente : reçue par Bob, envoyée par Alice
        mockMvc.perform(get("/api/relationships").with(BOB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pendingReceived[0].id").value(id))
                .andExpect(jsonPath("$.data.pendingReceived[0].counterpart.pseudo").value("alice"))
                .andExpect(jsonPath("$.data.accepted").isEmpty())
                .andExpect(jsonPath("$.error").doesNotExist());
        mockMvc.perform(get("/api/relationships").with(ALICE))
                .andExpect(jsonPath("$.data.pendingSent[0].id").value(id))
                .andExpect(jsonPath("$.data.accepted").isEmpty());

        // dans l'autre sens : doublon
        mockMvc.perform(post("/api/relationships").with(BOB)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\":" + aliceId + "}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.kind").value("DUPLICATE_RELATIONSHIP"))
                .andExpect(jsonPath("$.data").doesNotExist());

        // le demandeur ne peut pas accepter
        mockMvc.perform(post("/api/relationships/" + id + "/accept").with(ALICE))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.kind").value("NOT_AUTHORIZED"));

        mockMvc.perform(post("/api/relationships/" + id + "/accept").with(BOB))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ACCEPTED"));

        mockMvc.perform(get("/api/relationships").with(ALICE))
                .andExpect(jsonPath("$.data.accepted[0].id").value(id))
                .andExpect(jsonPath("$.data.pendingSent").isEmpty());
        mockMvc.perform(get("/api/relationships").with(BOB))
                .andExpect(jsonPath("$.data.accepted[0].id").value(id))
                .andExpect(jsonPath("$.data.pendingReceived").isEmpty());

        mockMvc.perform(delete("/api/relationships/" + id).with(BOB))
                .andExpect(status().isOk());
        assertThat(relationshipRepo.findAll()).isEmpty();

        // ligne vraiment supprimée : une nouvelle demande passe
        propose(BOB, aliceId);
    }

    @Test
    @WithMockUser(username = "alice@bump.test")
    void candidates_shouldIgnoreShortQueriesAndExcludeCaller() throws Exception {
        mockMvc.perform(get("/api/relationships/candidates").param("q", "al"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());

        mockMvc.perform(get("/api/relationships/candidates").param("q", "ALI"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());

        mockMvc.perform(get("/api/relationships/candidates").param("q", "BOB"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].pseudo").value("bobby"));
    }

    @Test
    void checkIn_visibilityAndSoftExpiry() throws Exception {
        Instant inOneHour = Instant.now().plus(1, ChronoUnit.HOURS);
        String json = mockMvc.perform(post("/api/checkins").with(ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"placeId\":" + placeId + ",\"privacy\":\"FRIENDS\",\"expiresAt\":\"" + inOneHour + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.activity").value("Hanging out"))
                .andExpect(jsonPath("$.data.place.name").value("Café Oberkampf"))
                .andReturn().getResponse().getContentAsString();
        long checkInId = idFrom(json);

        // pas encore amis : invisible pour Bob
        mockMvc.perform(get("/api/checkins").with(BOB))
                .andExpect(jsonPath("$.data").isEmpty());

        long rel = propose(ALICE, bobId);
        mockMvc.perform(post("/api/relationships/" + rel + "/accept").with(BOB)).andExpect(status().isOk());

        mockMvc.perform(get("/api/checkins/by-place").with(BOB))
                .andExpect(jsonPath("$.data[0].place.id").value(placeId))
                .andExpect(jsonPath("$.data[0].checkIns[0].id").value(checkInId));
        mockMvc.perform(get("/api/checkins").with(CAROL))
                .andExpect(jsonPath("$.data").isEmpty());

        // seul l'auteur peut expirer
        mockMvc.perform(delete("/api/checkins/" + checkInId).with(BOB))
                .andExpect(status().isForbidden());
        mockMvc.perform(delete("/api/checkins/" + checkInId).with(ALICE))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/checkins").with(ALICE))
                .andExpect(jsonPath("$.data").isEmpty());
        mockMvc.perform(get("/api/checkins/mine").with(ALICE))
                .andExpect(jsonPath("$.data[0].id").value(checkInId))
                .andExpect(jsonPath("$.data[0].expiresAt").exists());
        assertThat(checkInRepo.count()).isEqualTo(1);
    }

    @Test
    void checkIn_withMissingPlace_shouldReturnValidationError() throws Exception {
        mockMvc.perform(post("/api/checkins").with(ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"activity\":\"Volley\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.kind").value("VALIDATION"))
                .andExpect(jsonPath("$.error.message").value("Lieu manquant"));
    }

    @Test
    void sync_attachThenDetach() throws Exception {
        String json = mockMvc.perform(post("/api/sync").with(ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"table\":\"relationships\",\"filter\":\"status\",\"filterValue\":\"pending\",\"intervalMs\":1000}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.active").value(true))
                .andExpect(jsonPath("$.data.intervalMs").value(1000))
                .andReturn().getResponse().getContentAsString();
        String handle = JsonPath.read(json, "$.data.handle");

        // un autre utilisateur ne voit pas l'abonnement
        mockMvc.perform(get("/api/sync/" + handle).with(BOB))
                .andExpect(status().isNotFound());

        mockMvc.perform(delete("/api/sync/" + handle).with(ALICE))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/sync/" + handle).with(ALICE))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/sync").with(ALICE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"table\":\"settings\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.kind").value("VALIDATION"));
    }

    @Test
    void bearerToken_shouldAuthenticateAndMissingTokenShouldBeRejected() throws Exception {
        mockMvc.perform(get("/api/relationships"))
                .andExpect(status().isForbidden());

        String token = JwtTokens.signed("alice@bump.test");
        mockMvc.perform(get("/api/relationships").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.accepted").isArray());

        Instant past = Instant.now().minus(2, ChronoUnit.HOURS);
        String expired = JwtTokens.signed("alice@bump.test", past, past.plus(1, ChronoUnit.HOURS), JwtTokens.TEST_SECRET);
        mockMvc.perform(get("/api/relationships").header("Authorization", "Bearer " + expired))
                .andExpect(status().isForbidden());
    }
}
