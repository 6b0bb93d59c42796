package com.finlogic.skill_gap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkillGapApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillGapApplication.class, args);
    }
}
