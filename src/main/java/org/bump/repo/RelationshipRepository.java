package org.bump.repo;

import org.bump.model.Relationship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface RelationshipRepository extends JpaRepository<Relationship, Long> {

    // Une paire {A,B} ne peut exister qu'une fois, dans un sens ou dans l'autre
    boolean existsByPairKey(String pairKey);

    // Toutes les lignes où l'utilisateur est l'une des deux parties
    @Query("select r from Relationship r where r.requesterId = :userId or r.recipientId = :userId "
            + "order by r.createdAt desc, r.id desc")
    List<Relationship> findParticipating(@Param("userId") Long userId);

    // Mise à jour conditionnelle : 0 si la ligne a disparu ou n'est plus dans l'état attendu
    @Transactional
    @Modifying
    @Query("update Relationship r set r.status = :to, r.updatedAt = :now "
            + "where r.id = :id and r.recipientId = :recipientId and r.status = :from")
    int updateStatusByRecipient(@Param("id") Long id,
                                @Param("recipientId") Long recipientId,
                                @Param("from") Relationship.Status from,
                                @Param("to") Relationship.Status to,
                                @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("update Relationship r set r.hopeToBump = :value, r.updatedAt = :now "
            + "where r.id = :id and r.requesterId = :requesterId")
    int updateHopeToBumpByRequester(@Param("id") Long id,
                                    @Param("requesterId") Long requesterId,
                                    @Param("value") boolean value,
                                    @Param("now") Instant now);
}
