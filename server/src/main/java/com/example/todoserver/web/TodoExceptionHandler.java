package com.example.todoserver.web;

import com.example.todoserver.todo.TodoNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice(assignableTypes = TodoController.class)
public class TodoExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(TodoExceptionHandler.class);

    @ExceptionHandler(TodoNotFoundException.class)
    public ResponseEntity<Void> handleNotFound(TodoNotFoundException ex) {
        log.info("Unable to find todo by id: {}", ex.getTodoId());
        return ResponseEntity.notFound().build();
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Void> handleMalformedId(MethodArgumentTypeMismatchException ex) {
        log.info("Unable to parse {}: {}", ex.getName(), ex.getValue());
        return ResponseEntity.notFound().build();
    }
}
