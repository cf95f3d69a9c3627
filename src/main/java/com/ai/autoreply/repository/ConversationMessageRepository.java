package com.ai.autoreply.repository;

import com.ai.autoreply.entity.ConversationMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {

    List<ConversationMessage> findByAgentIdAndPhoneNumberOrderByIdDesc(Long agentId, String phoneNumber, Pageable pageable);

    List<ConversationMessage> findByAgentIdAndPhoneNumberAndIdNotOrderByIdDesc(Long agentId, String phoneNumber,
                                                                              Long excludedId, Pageable pageable);
}
