package com.example.todoserver.web;

import com.example.todoserver.todo.TodoRepository;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestParam;

@Controller
public class TodoController {

    static final String INDEX_VIEW = "index";
    static final String LIST_VIEW = "partials/todo-list";
    static final String DEFAULT_TITLE = "unknown";

    private final TodoRepository todoRepository;

    public TodoController(TodoRepository todoRepository) {
        this.todoRepository = todoRepository;
    }

    @GetMapping("/")
    public String index(Model model) {
        populateLists(model);
        return INDEX_VIEW;
    }

    @GetMapping("/todos")
    public String list(Model model) {
        populateLists(model);
        return LIST_VIEW;
    }

    @PostMapping("/todos")
    public String create(@RequestParam(name = "todo", defaultValue = DEFAULT_TITLE) String title, Model model) {
        todoRepository.add(title, false);
        return list(model);
    }

    @PutMapping("/todos/{todo_id}/toggle")
    public String toggle(@PathVariable("todo_id") long todoId, Model model) {
        todoRepository.toggle(todoId);
        return list(model);
    }

    @DeleteMapping("/todos/{todo_id}")
    public String delete(@PathVariable("todo_id") long todoId, Model model) {
        todoRepository.delete(todoId);
        return list(model);
    }

    private void populateLists(Model model) {
        model.addAttribute("todosOpen", todoRepository.listByStatus(false));
        model.addAttribute("todosDone", todoRepository.listByStatus(true));
    }
}
