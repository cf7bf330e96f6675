package com.mifinca.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ProblemResponseTest {

    @Test
    @DisplayName("a service code is kept as is and names the problem type")
    void serviceCode() {
        ProblemResponse body = ProblemResponse.of(HttpStatus.NOT_FOUND, "ANIMAL_NOT_FOUND", null, "/animals/42");

        assertThat(body.code()).isEqualTo("ANIMAL_NOT_FOUND");
        assertThat(body.type()).isEqualTo("urn:mifinca:problem:animal-not-found");
        assertThat(body.status()).isEqualTo(404);
        assertThat(body.detail()).isEqualTo("Not Found");
        assertThat(body.instance()).isEqualTo("/animals/42");
    }

    @Test
    @DisplayName("a free-text reason is folded into an upper snake code")
    void freeTextReason() {
        ProblemResponse body = ProblemResponse.of(HttpStatus.BAD_REQUEST, "Invalid farm id", "Invalid farm id", "/lots");

        assertThat(body.code()).isEqualTo("INVALID_FARM_ID");
        assertThat(body.detail()).isEqualTo("Invalid farm id");
    }

    @Test
    @DisplayName("a missing code falls back to the status name")
    void missingCode() {
        ProblemResponse body = ProblemResponse.of(HttpStatus.CONFLICT, " ", null, "/farms");

        assertThat(body.code()).isEqualTo("CONFLICT");
        assertThat(body.type()).isEqualTo("urn:mifinca:problem:conflict");
        assertThat(body.title()).isEqualTo("Conflict");
    }
}
