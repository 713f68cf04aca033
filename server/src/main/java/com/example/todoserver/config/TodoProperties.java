package com.example.todoserver.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "todo")
public class TodoProperties {

    private List<SeedTodo> seed = new ArrayList<>();

    @Data
    public static class SeedTodo {
        private String title;
        private boolean done;
    }
}
