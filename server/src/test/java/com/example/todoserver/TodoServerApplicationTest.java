package com.example.todoserver;

import com.example.todoserver.todo.Todo;
import com.example.todoserver.todo.TodoRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class TodoServerApplicationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private TodoRepository repository;

    @Test
    void shouldServeSeededTodosOnIndex() {
        ResponseEntity<String> resp = restTemplate.getForEntity(url("/"), String.class);

        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertNotNull(resp.getBody());
        assertTrue(resp.getBody().contains("first todo"));
        assertTrue(resp.getBody().contains("fifth todo"));
        assertNotNull(resp.getHeaders().getFirst("X-Trace-Id"));
    }

    @Test
    void shouldCreateToggleAndDeleteOverHttp() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("todo", "round trip todo");

        ResponseEntity<String> created = restTemplate.postForEntity(url("/todos"), new HttpEntity<>(form, headers), String.class);
        assertEquals(HttpStatus.OK, created.getStatusCode());
        assertTrue(created.getBody().contains("round trip todo"));

        Todo todo = repository.findAll().stream()
                .filter(t -> "round trip todo".equals(t.getTitle()))
                .findFirst()
                .orElseThrow();
        assertFalse(todo.isDone());

        ResponseEntity<String> toggled = restTemplate.exchange(
                url("/todos/" + todo.getId() + "/toggle"), HttpMethod.PUT, null, String.class);
        assertEquals(HttpStatus.OK, toggled.getStatusCode());
        assertTrue(repository.find(todo.getId()).orElseThrow().isDone());

        ResponseEntity<String> deleted = restTemplate.exchange(
                url("/todos/" + todo.getId()), HttpMethod.DELETE, null, String.class);
        assertEquals(HttpStatus.OK, deleted.getStatusCode());
        assertFalse(repository.find(todo.getId()).isPresent());

        ResponseEntity<String> missing = restTemplate.exchange(
                url("/todos/" + todo.getId()), HttpMethod.DELETE, null, String.class);
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }

    @Test
    void shouldAnswerNotFoundForMalformedId() {
        ResponseEntity<String> resp = restTemplate.exchange(url("/todos/not-a-number/toggle"), HttpMethod.PUT, null, String.class);

        assertEquals(HttpStatus.NOT_FOUND, resp.getStatusCode());
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }
}
