package com.aim.auth.security;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TemporaryPasswordGeneratorTest {

    private final TemporaryPasswordGenerator generator = new TemporaryPasswordGenerator();
    private final PasswordPolicy policy = new PasswordPolicy();

    @Test
    void generate_AlwaysSatisfiesPolicy() {
        for (int i = 0; i < 500; i++) {
            String password = generator.generate();
            assertThat(password).hasSize(TemporaryPasswordGenerator.LENGTH);
            assertThatCode(() -> policy.validate(password)).as(password).doesNotThrowAnyException();
        }
    }

    @Test
    void generate_ProducesDistinctValues() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.add(generator.generate());
        }

        assertThat(seen).hasSize(200);
    }
}
