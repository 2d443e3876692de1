package org.bump.repo;

import org.bump.model.CheckIn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface CheckInRepository extends JpaRepository<CheckIn, Long> {

    // Actif = sans expiration ou expiration strictement dans le futur, plus récents d'abord
    @Query("select c from CheckIn c where c.expiresAt is null or c.expiresAt > :now "
            + "order by c.createdAt desc, c.id desc")
    List<CheckIn> findActive(@Param("now") Instant now);

    List<CheckIn> findBySubjectIdOrderByCreatedAtDescIdDesc(Long subjectId);
}
