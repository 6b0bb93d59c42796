package com.finlogic.skill_gap.config;

import com.finlogic.skill_gap.matcher.MatchRules;
import com.finlogic.skill_gap.matcher.SkillMatcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SkillGapConfig {

    // rule order is part of the matching contract, see MatchRules.defaultCascade()
    @Bean
    public SkillMatcher skillMatcher() {
        return new SkillMatcher(MatchRules.defaultCascade());
    }
}
