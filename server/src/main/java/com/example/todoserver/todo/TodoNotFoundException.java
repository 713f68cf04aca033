package com.example.todoserver.todo;

import lombok.Getter;

@Getter
public class TodoNotFoundException extends RuntimeException {

    private final long todoId;

    public TodoNotFoundException(long todoId) {
        super("Unable to find todo with ID: " + todoId);
        this.todoId = todoId;
    }
}
