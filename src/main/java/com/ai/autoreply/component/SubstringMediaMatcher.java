package com.ai.autoreply.component;

import com.ai.autoreply.entity.AgentMedia;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive containment in either direction; first catalog entry wins.
 */
@Component
public class SubstringMediaMatcher implements MediaMatcher {

    @Override
    public Optional<AgentMedia> match(String requestedName, List<AgentMedia> catalog) {
        if (StringUtils.isBlank(requestedName) || catalog == null) {
            return Optional.empty();
        }
        String requested = requestedName.trim().toLowerCase(Locale.ROOT);
        for (AgentMedia item : catalog) {
            if (StringUtils.isBlank(item.getName())) continue;
            String name = item.getName().trim().toLowerCase(Locale.ROOT);
            if (name.contains(requested) || requested.contains(name)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }
}
