package com.taskmate.backend.modules.task.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.taskmate.backend.global.error.ProblemException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpStatus;

class TaskFieldValidatorTest {

    @Test
    void titleIsTrimmed() {
        assertThat(TaskFieldValidator.normalizeTitle("  Buy milk \n")).isEqualTo("Buy milk");
    }

    @Test
    void titleOfExactly200CharactersIsAccepted() {
        String title = "a".repeat(200);

        assertThat(TaskFieldValidator.normalizeTitle(title)).hasSize(200);
    }

    @Test
    void titleOf201CharactersIsRejected() {
        assertThatThrownBy(() -> TaskFieldValidator.normalizeTitle("a".repeat(201)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo(TaskFieldValidator.TITLE_TOO_LONG);
                });
    }

    @Test
    void lengthIsMeasuredAfterTrimming() {
        assertThat(TaskFieldValidator.normalizeTitle("  " + "a".repeat(200) + "  ")).hasSize(200);
    }

    @Test
    void lengthCountsCharactersNotUtf16Units() {
        String emoji = "\uD83D\uDE00";

        assertThat(TaskFieldValidator.normalizeTitle(emoji.repeat(200))).isEqualTo(emoji.repeat(200));
        assertThatThrownBy(() -> TaskFieldValidator.normalizeTitle(emoji.repeat(201)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(TaskFieldValidator.TITLE_TOO_LONG));

        assertThat(TaskFieldValidator.normalizeDescription(emoji.repeat(1000))).isEqualTo(emoji.repeat(1000));
        assertThatThrownBy(() -> TaskFieldValidator.normalizeDescription(emoji.repeat(1001)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(TaskFieldValidator.DESCRIPTION_TOO_LONG));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t\n"})
    void blankTitlesAreRejected(String title) {
        assertThatThrownBy(() -> TaskFieldValidator.normalizeTitle(title))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(TaskFieldValidator.TITLE_REQUIRED));
    }

    @Test
    void blankDescriptionBecomesNull() {
        assertThat(TaskFieldValidator.normalizeDescription("   ")).isNull();
        assertThat(TaskFieldValidator.normalizeDescription(null)).isNull();
    }

    @Test
    void descriptionLimitIs1000Characters() {
        assertThat(TaskFieldValidator.normalizeDescription("d".repeat(1000))).hasSize(1000);
        assertThatThrownBy(() -> TaskFieldValidator.normalizeDescription("d".repeat(1001)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(TaskFieldValidator.DESCRIPTION_TOO_LONG));
    }
}
