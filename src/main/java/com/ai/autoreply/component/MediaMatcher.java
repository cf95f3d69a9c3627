package com.ai.autoreply.component;

import com.ai.autoreply.entity.AgentMedia;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a media name requested by the model against the agent's catalog.
 */
public interface MediaMatcher {

    Optional<AgentMedia> match(String requestedName, List<AgentMedia> catalog);
}
