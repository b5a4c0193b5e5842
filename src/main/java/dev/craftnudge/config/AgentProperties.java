package dev.craftnudge.config;

import dev.craftnudge.domain.enums.AgentKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumSet;
import java.util.Set;

@ConfigurationProperties(prefix = "craftnudge.agents")
public record AgentProperties(AgentConfig codeAnalysis, AgentConfig commitAnalysis) {
    public AgentProperties {
        if (codeAnalysis == null) codeAnalysis = new AgentConfig(true, "codellama:7b", 0.1);
        if (commitAnalysis == null) commitAnalysis = new AgentConfig(true, "llama2:7b", 0.2);
    }

    public record AgentConfig(boolean enabled, String model, double temperature) {
        public AgentConfig { if (temperature < 0) temperature = 0.1; }
    }

    public AgentConfig forKind(AgentKind kind) {
        return switch (kind) {
            case CODE_ANALYSIS -> codeAnalysis;
            case COMMIT_ANALYSIS -> commitAnalysis;
        };
    }

    public Set<AgentKind> enabledKinds() {
        Set<AgentKind> kinds = EnumSet.noneOf(AgentKind.class);
        for (AgentKind kind : AgentKind.values()) {
            if (forKind(kind).enabled()) kinds.add(kind);
        }
        return kinds;
    }
}
