package com.example.todoserver.todo;

import com.example.todoserver.config.TodoProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class TodoSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TodoSeeder.class);

    private final TodoRepository todoRepository;
    private final TodoProperties properties;

    public TodoSeeder(TodoRepository todoRepository, TodoProperties properties) {
        this.todoRepository = todoRepository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        int seeded = 0;
        for (TodoProperties.SeedTodo seed : properties.getSeed()) {
            if (seed.getTitle() == null || seed.getTitle().isBlank()) {
                log.warn("Skipping seed todo without a title");
                continue;
            }
            Todo todo = todoRepository.add(seed.getTitle(), seed.isDone());
            log.debug("Seeded todo id={} title={}", todo.getId(), todo.getTitle());
            seeded++;
        }
        log.info("Todo repository seeded with {} todos", seeded);
    }
}
