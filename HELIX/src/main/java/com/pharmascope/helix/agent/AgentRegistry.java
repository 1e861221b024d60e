package com.pharmascope.helix.agent;

import com.pharmascope.helix.domain.model.AnalysisType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed set of research agents known at startup, keyed by name.
 */
@Slf4j
@Component
public class AgentRegistry {

    private final Map<String, ResearchAgent> agents;

    public AgentRegistry(List<ResearchAgent> discovered) {
        List<String> canonical = AnalysisType.COMPREHENSIVE.getAgents();
        List<ResearchAgent> ordered = new ArrayList<>(discovered);
        ordered.sort(Comparator.comparingInt(agent -> {
            int index = canonical.indexOf(agent.getName());
            return index >= 0 ? index : Integer.MAX_VALUE;
        }));

        Map<String, ResearchAgent> byName = new LinkedHashMap<>();
        for (ResearchAgent agent : ordered) {
            ResearchAgent previous = byName.putIfAbsent(agent.getName(), agent);
            if (previous != null) {
                throw new IllegalStateException("Duplicate research agent name: " + agent.getName());
            }
        }
        this.agents = Collections.unmodifiableMap(byName);
        log.info("Registered {} research agents: {}", agents.size(), agents.keySet());
    }

    public Optional<ResearchAgent> find(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    public ResearchAgent get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + name));
    }

    public boolean contains(String name) {
        return agents.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(agents.keySet());
    }

    public Collection<ResearchAgent> all() {
        return agents.values();
    }
}
