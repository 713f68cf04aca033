package com.example.todoserver.todo;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

@Getter
@ToString
@EqualsAndHashCode
public final class Todo {

    private final long id;
    private final String title;
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final Instant completedAt;

    Todo(long id, String title, Instant createdAt, Instant completedAt) {
        this.id = id;
        this.title = Objects.requireNonNull(title, "title cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
        this.completedAt = completedAt;
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public boolean isDone() {
        return completedAt != null;
    }

    Todo completedAt(Instant at) {
        return new Todo(id, title, createdAt, Objects.requireNonNull(at, "at cannot be null"));
    }

    Todo reopened() {
        return new Todo(id, title, createdAt, null);
    }
}
