package io.mnemo.core.filter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class FilterBuilder {
    public static final String USER_ID = "user_id";
    public static final String AGENT_ID = "agent_id";
    public static final String TEAM_ID = "team_id";
    public static final String TOPICS = "topics";

    private FilterBuilder() {
    }

    public static Filter build(String userId, String agentId, String teamId, List<String> topics) {
        List<Condition> conditions = new ArrayList<>();
        if (userId != null) {
            conditions.add(new MatchValue(USER_ID, userId));
        }
        if (agentId != null) {
            conditions.add(new MatchValue(AGENT_ID, agentId));
        }
        if (teamId != null) {
            conditions.add(new MatchValue(TEAM_ID, teamId));
        }

        Set<String> wanted = new LinkedHashSet<>();
        if (topics != null) {
            for (String topic : topics) {
                if (topic != null && !topic.isBlank()) {
                    wanted.add(topic.trim());
                }
            }
        }
        if (!wanted.isEmpty()) {
            conditions.add(new MatchAny(TOPICS, List.copyOf(wanted)));
        }

        if (conditions.isEmpty()) {
            return Filter.empty();
        }
        return new Filter(conditions);
    }
}
