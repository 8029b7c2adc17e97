package com.tenantoptions.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ModelLabel")
class ModelLabelTest {

    @Test
    @DisplayName("should parse app and model name")
    void shouldParse() {
        var label = ModelLabel.parse("tasks.TaskPriority");

        assertThat(label.app()).isEqualTo("tasks");
        assertThat(label.name()).isEqualTo("TaskPriority");
        assertThat(label.modelName()).isEqualTo("taskpriority");
        assertThat(label.defaultTable()).isEqualTo("tasks_taskpriority");
        assertThat(label).hasToString("tasks.TaskPriority");
    }

    @ParameterizedTest
    @ValueSource(strings = {"TaskPriority", "tasks.", ".TaskPriority", "a.b.c", "tasks.Task-Priority"})
    @DisplayName("should reject malformed labels")
    void shouldRejectMalformed(String label) {
        assertThatThrownBy(() -> ModelLabel.parse(label)).isInstanceOf(ModelLabelException.class);
    }

    @Test
    @DisplayName("should reject null")
    void shouldRejectNull() {
        assertThatThrownBy(() -> ModelLabel.parse(null)).isInstanceOf(ModelLabelException.class);
    }
}
