package com.ai.autoreply.repository;

import com.ai.autoreply.entity.CollectedField;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface CollectedFieldRepository extends JpaRepository<CollectedField, Long> {

    List<CollectedField> findByAgentIdAndPhoneNumberOrderByIdAsc(Long agentId, String phoneNumber);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CollectedField c SET c.fieldValue = :value, c.updatedAt = :at "
            + "WHERE c.agentId = :agentId AND c.phoneNumber = :phone AND c.fieldKey = :fieldKey")
    int updateValue(@Param("agentId") Long agentId, @Param("phone") String phoneNumber,
                    @Param("fieldKey") String fieldKey, @Param("value") String value, @Param("at") Instant at);
}
