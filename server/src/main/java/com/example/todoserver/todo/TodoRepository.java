package com.example.todoserver.todo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Repository
public class TodoRepository {

    private static final Logger log = LoggerFactory.getLogger(TodoRepository.class);

    // most recently completed first when both are done, otherwise most recently created first
    static final Comparator<Todo> NEWEST_FIRST = (a, b) -> {
        if (a.isDone() && b.isDone()) {
            return b.getCompletedAt().get().compareTo(a.getCompletedAt().get());
        }
        return b.getCreatedAt().compareTo(a.getCreatedAt());
    };

    private final List<Todo> todos = new ArrayList<>();
    private final AtomicLong nextId = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;

    public TodoRepository(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public Todo add(String title, boolean initiallyDone) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            Instant now = clock.instant();
            Todo todo = new Todo(nextId.incrementAndGet(), title, now, initiallyDone ? now : null);
            todos.add(todo);
            log.info("Todo created: id={} done={}", todo.getId(), initiallyDone);
            return todo;
        } finally {
            writeLock.unlock();
        }
    }

    public Todo toggle(long id) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            int index = indexOf(id);
            Todo existing = todos.get(index);
            Todo toggled = existing.isDone() ? existing.reopened() : existing.completedAt(clock.instant());
            todos.set(index, toggled);
            log.info("Todo toggled: id={} done={}", id, toggled.isDone());
            return toggled;
        } finally {
            writeLock.unlock();
        }
    }

    public void delete(long id) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            todos.remove(indexOf(id));
            log.info("Todo deleted: id={}", id);
        } finally {
            writeLock.unlock();
        }
    }

    public Optional<Todo> find(long id) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return todos.stream().filter(todo -> todo.getId() == id).findFirst();
        } finally {
            readLock.unlock();
        }
    }

    public List<Todo> findAll() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return List.copyOf(todos);
        } finally {
            readLock.unlock();
        }
    }

    public List<Todo> listByStatus(boolean done) {
        List<Todo> result = new ArrayList<>();
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            for (Todo todo : todos) {
                if (todo.isDone() == done) {
                    result.add(todo);
                }
            }
        } finally {
            readLock.unlock();
        }
        // stable: equal timestamps keep insertion order
        result.sort(NEWEST_FIRST);
        return result;
    }

    public int size() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return todos.size();
        } finally {
            readLock.unlock();
        }
    }

    // caller holds a lock
    private int indexOf(long id) {
        for (int i = 0; i < todos.size(); i++) {
            if (todos.get(i).getId() == id) {
                return i;
            }
        }
        throw new TodoNotFoundException(id);
    }
}
