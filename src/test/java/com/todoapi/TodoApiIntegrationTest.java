package com.todoapi;

import com.todoapi.model.dto.TodoListResponse;
import com.todoapi.model.dto.TodoResponse;
import com.todoapi.model.dto.TokenResponse;
import com.todoapi.model.dto.UserResponse;
import com.todoapi.model.entity.TodoStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests against an in-memory H2 database.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class TodoApiIntegrationTest {

    private static final String PASSWORD = "Valid1Pass!";

    @Autowired
    private WebTestClient webTestClient;

    private UserResponse register(String name) {
        return webTestClient.post()
                .uri("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "email", name + "@example.com",
                        "username", name,
                        "password", PASSWORD))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(UserResponse.class)
                .returnResult()
                .getResponseBody();
    }

    private String login(String email) {
        TokenResponse token = webTestClient.post()
                .uri("/auth/login")
                .body(BodyInserters.fromFormData("username", email).with("password", PASSWORD))
                .exchange()
                .expectStatus().isOk()
                .expectBody(TokenResponse.class)
                .returnResult()
                .getResponseBody();
        assertThat(token).isNotNull();
        assertThat(token.getTokenType()).isEqualTo("bearer");
        return token.getAccessToken();
    }

    private String newUserToken() {
        UserResponse user = register(uniqueName());
        return login(user.getEmail());
    }

    private static String uniqueName() {
        return "user" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private TodoResponse createTodo(String token, String title) {
        return webTestClient.post()
                .uri("/todos")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("title", title, "description", "Description of " + title))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(TodoResponse.class)
                .returnResult()
                .getResponseBody();
    }

    @Test
    void registerLoginAndReadProfile() {
        String name = uniqueName();
        UserResponse registered = register(name);
        assertThat(registered.getId()).isNotNull();
        assertThat(registered.isActive()).isTrue();

        String token = login(name + "@example.com");

        webTestClient.get()
                .uri("/auth/me")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo(registered.getId().intValue())
                .jsonPath("$.username").isEqualTo(name);
    }

    @Test
    void duplicateEmailAndUsernameAreRejected() {
        String name = uniqueName();
        register(name);

        webTestClient.post()
                .uri("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("email", name + "@example.com", "username", uniqueName(), "password", PASSWORD))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Email already registered");

        webTestClient.post()
                .uri("/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("email", uniqueName() + "@example.com", "username", name, "password", PASSWORD))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Username already taken");
    }

    @Test
    void wrongPasswordIsRejected() {
        UserResponse user = register(uniqueName());

        webTestClient.post()
                .uri("/auth/login")
                .body(BodyInserters.fromFormData("username", user.getEmail()).with("password", "Wrong1Pass!"))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Incorrect email or password");
    }

    @Test
    void todosAreIsolatedBetweenUsers() {
        String alice = newUserToken();
        String bob = newUserToken();
        TodoResponse todo = createTodo(alice, "Alice's task");

        webTestClient.get()
                .uri("/todos/{id}", todo.getId())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bob)
                .exchange()
                .expectStatus().isNotFound();

        webTestClient.put()
                .uri("/todos/{id}", todo.getId())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bob)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("title", "Hijacked"))
                .exchange()
                .expectStatus().isNotFound();

        webTestClient.delete()
                .uri("/todos/{id}", todo.getId())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bob)
                .exchange()
                .expectStatus().isNotFound();

        webTestClient.get()
                .uri("/todos")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bob)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(0);

        webTestClient.get()
                .uri("/todos/{id}", todo.getId())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + alice)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.title").isEqualTo("Alice's task");
    }

    @Test
    void listPaginatesAndFiltersByStatus() {
        String token = newUserToken();
        for (int i = 0; i < 5; i++) {
            createTodo(token, "Task " + i);
        }
        TodoResponse second = createTodo(token, "Finished task");

        webTestClient.put()
                .uri("/todos/{id}", second.getId())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "Done"))
                .exchange()
                .expectStatus().isOk();

        TodoListResponse page = webTestClient.get()
                .uri("/todos?skip=2&limit=2")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isOk()
                .expectBody(TodoListResponse.class)
                .returnResult()
                .getResponseBody();
        assertThat(page).isNotNull();
        assertThat(page.getTotal()).isEqualTo(6);
        assertThat(page.getTodos()).extracting(TodoResponse::getTitle).containsExactly("Task 2", "Task 3");

        TodoListResponse done = webTestClient.get()
                .uri("/todos?status_filter=Done")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isOk()
                .expectBody(TodoListResponse.class)
                .returnResult()
                .getResponseBody();
        assertThat(done).isNotNull();
        assertThat(done.getTotal()).isEqualTo(1);
        assertThat(done.getTodos()).extracting(TodoResponse::getStatus).containsExactly(TodoStatus.DONE);

        webTestClient.get()
                .uri("/todos?limit=1001")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isEqualTo(422);
    }

    @Test
    void partialUpdateKeepsUntouchedFields() {
        String token = newUserToken();
        TodoResponse created = createTodo(token, "Write report");

        Map<String, Object> patch = new HashMap<>();
        patch.put("description", "Quarterly numbers");
        patch.put("due_date", null);

        TodoResponse updated = webTestClient.put()
                .uri("/todos/{id}", created.getId())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(patch)
                .exchange()
                .expectStatus().isOk()
                .expectBody(TodoResponse.class)
                .returnResult()
                .getResponseBody();

        assertThat(updated).isNotNull();
        assertThat(updated.getTitle()).isEqualTo("Write report");
        assertThat(updated.getDescription()).isEqualTo("Quarterly numbers");
        assertThat(updated.getStatus()).isEqualTo(TodoStatus.PENDING);
        assertThat(updated.getDueDate()).isNull();
        assertThat(updated.getUpdatedAt()).isAfterOrEqualTo(created.getUpdatedAt());
    }

    @Test
    void deletedTodoIsGone() {
        String token = newUserToken();
        TodoResponse todo = createTodo(token, "Temporary");

        webTestClient.delete()
                .uri("/todos/{id}", todo.getId())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isNoContent();

        webTestClient.get()
                .uri("/todos/{id}", todo.getId())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void deletingAccountRemovesTodosAndInvalidatesToken() {
        String token = newUserToken();
        createTodo(token, "Left behind");

        webTestClient.delete()
                .uri("/auth/me")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isNoContent();

        webTestClient.get()
                .uri("/todos")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Could not validate credentials");
    }

    @Test
    void serviceInfoIsPublic() {
        webTestClient.get()
                .uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Welcome to the Todo API");
    }
}
