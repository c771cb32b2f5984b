package com.todoapi.model.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.todoapi.model.entity.TodoStatus;
import com.todoapi.model.patch.PatchField;
import com.todoapi.model.patch.TodoPatch;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for todo request validation and partial update presence tracking.
 */
class TodoRequestValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    private static <T> Set<String> invalidFields(T request) {
        return validator.validate(request).stream()
                .map(ConstraintViolation::getPropertyPath)
                .map(Object::toString)
                .collect(Collectors.toSet());
    }

    private TodoCreateRequest createWithDueDate(OffsetDateTime dueDate) {
        return TodoCreateRequest.builder()
                .title("Buy groceries")
                .description("Milk, eggs, bread")
                .dueDate(dueDate)
                .build();
    }

    @Test
    void dueDateOneSecondInThePast_IsRejected() {
        OffsetDateTime past = OffsetDateTime.now(ZoneOffset.UTC).minusSeconds(1);

        assertThat(invalidFields(createWithDueDate(past))).containsExactly("dueDate");
    }

    @Test
    void dueDateOneSecondInTheFuture_IsAccepted() {
        OffsetDateTime future = OffsetDateTime.now(ZoneOffset.UTC).plusSeconds(1);

        assertThat(invalidFields(createWithDueDate(future))).isEmpty();
    }

    @Test
    void dueDateComparesInstantsAcrossTimeZones() {
        // Local wall clock ahead of UTC, but the instant is in the past
        OffsetDateTime past = OffsetDateTime.now(ZoneOffset.ofHours(10)).minusMinutes(1);
        OffsetDateTime future = OffsetDateTime.now(ZoneOffset.ofHours(-10)).plusMinutes(1);

        assertThat(invalidFields(createWithDueDate(past))).containsExactly("dueDate");
        assertThat(invalidFields(createWithDueDate(future))).isEmpty();
    }

    @Test
    void dueDateIsOptional() {
        assertThat(invalidFields(createWithDueDate(null))).isEmpty();
    }

    @Test
    void titleAndDescriptionBounds() {
        TodoCreateRequest request = TodoCreateRequest.builder()
                .title("x".repeat(61))
                .description("")
                .build();

        assertThat(invalidFields(request)).containsExactlyInAnyOrder("title", "description");
        assertThat(invalidFields(new TodoCreateRequest())).containsExactlyInAnyOrder("title", "description");

        request.setTitle("x".repeat(60));
        request.setDescription("d");
        assertThat(invalidFields(request)).isEmpty();
    }

    @Test
    void titleLengthCountsCharactersNotCodeUnits() {
        TodoCreateRequest request = TodoCreateRequest.builder()
                .title("\uD83D\uDE00".repeat(60))
                .description("d")
                .build();
        assertThat(invalidFields(request)).isEmpty();

        request.setTitle("\uD83D\uDE00".repeat(61));
        assertThat(invalidFields(request)).containsExactly("title");

        TodoUpdateRequest update = new TodoUpdateRequest();
        update.setTitle("\uD83D\uDE00".repeat(60));
        assertThat(invalidFields(update)).isEmpty();
    }

    @Test
    void updateRequest_AbsentFieldsStayAbsent() throws Exception {
        TodoUpdateRequest request = objectMapper.readValue("{\"status\":\"Done\"}", TodoUpdateRequest.class);
        TodoPatch patch = request.toPatch();

        assertThat(invalidFields(request)).isEmpty();
        assertThat(patch.getStatus()).isEqualTo(PatchField.of(TodoStatus.DONE));
        assertThat(patch.getTitle().isPresent()).isFalse();
        assertThat(patch.getDescription().isPresent()).isFalse();
        assertThat(patch.getDueDate().isPresent()).isFalse();
    }

    @Test
    void updateRequest_EmptyBodyIsEmptyPatch() throws Exception {
        TodoUpdateRequest request = objectMapper.readValue("{}", TodoUpdateRequest.class);

        assertThat(invalidFields(request)).isEmpty();
        assertThat(request.toPatch()).isEqualTo(TodoPatch.empty());
    }

    @Test
    void updateRequest_ExplicitNullDueDateIsPresent() throws Exception {
        TodoUpdateRequest request = objectMapper.readValue("{\"due_date\":null}", TodoUpdateRequest.class);

        assertThat(invalidFields(request)).isEmpty();
        assertThat(request.toPatch().getDueDate()).isEqualTo(PatchField.of(null));
    }

    @Test
    void updateRequest_ExplicitNullTitleIsRejected() throws Exception {
        TodoUpdateRequest request = objectMapper.readValue("{\"title\":null}", TodoUpdateRequest.class);

        assertThat(invalidFields(request)).containsExactly("titleNotNull");
    }

    @Test
    void updateRequest_PastDueDateIsRejected() throws Exception {
        String past = OffsetDateTime.now(ZoneOffset.UTC).minusSeconds(1).toString();
        TodoUpdateRequest request =
                objectMapper.readValue("{\"due_date\":\"" + past + "\"}", TodoUpdateRequest.class);

        assertThat(invalidFields(request)).containsExactly("dueDate");
    }
}
