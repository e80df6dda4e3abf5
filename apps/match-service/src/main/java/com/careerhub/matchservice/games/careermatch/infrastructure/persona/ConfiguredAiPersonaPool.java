package com.careerhub.matchservice.games.careermatch.infrastructure.persona;

import com.careerhub.matchservice.common.random.RandomSource;
import com.careerhub.matchservice.games.careermatch.config.CareerMatchProperties;
import com.careerhub.matchservice.games.careermatch.domain.model.AiPersona;
import com.careerhub.matchservice.games.careermatch.domain.port.AiPersonaPool;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 配置驱动的 AI 人设池；未配置时使用内置名单。
 */
@Component
public class ConfiguredAiPersonaPool implements AiPersonaPool {

    static final List<AiPersona> DEFAULT_ROSTER = List.of(
            new AiPersona("ai-nova", "Nova", "friendly"),
            new AiPersona("ai-atlas", "Atlas", "friendly"),
            new AiPersona("ai-juniper", "Juniper", "friendly"),
            new AiPersona("ai-orion", "Orion", "friendly"),
            new AiPersona("ai-maple", "Maple", "friendly"),
            new AiPersona("ai-pixel", "Pixel", "friendly"),
            new AiPersona("ai-sage", "Sage", "friendly"),
            new AiPersona("ai-echo", "Echo", "friendly"),
            new AiPersona("ai-river", "River", "friendly"),
            new AiPersona("ai-comet", "Comet", "friendly"),
            new AiPersona("ai-willow", "Willow", "friendly"),
            new AiPersona("ai-blaze", "Blaze", "friendly")
    );

    private final List<AiPersona> roster;
    private final RandomSource random;

    public ConfiguredAiPersonaPool(CareerMatchProperties props, RandomSource random) {
        this.random = random;
        List<CareerMatchProperties.PersonaConfig> configured = props.getAiFill().getPersonas();
        if (configured == null || configured.isEmpty()) {
            this.roster = DEFAULT_ROSTER;
        } else {
            this.roster = configured.stream()
                    .map(c -> new AiPersona(c.getId(), c.getDisplayName(), c.getPersonality()))
                    .toList();
        }
    }

    @Override
    public List<AiPersona> draw(int count, Set<String> excludedIds) {
        List<AiPersona> candidates = new ArrayList<>();
        for (AiPersona p : roster) {
            if (!excludedIds.contains(p.getId())) {
                candidates.add(p);
            }
        }
        random.shuffle(candidates);
        return List.copyOf(candidates.subList(0, Math.min(count, candidates.size())));
    }
}
