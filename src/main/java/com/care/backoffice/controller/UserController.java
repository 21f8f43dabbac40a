package com.care.backoffice.controller;

import com.care.backoffice.dto.UserCreateRequest;
import com.care.backoffice.dto.UserUpdateRequest;
import com.care.backoffice.dto.UserView;
import com.care.backoffice.service.UserService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public List<UserView> list() {
        return userService.list();
    }

    @PostMapping
    public ResponseEntity<UserView> create(@Valid @RequestBody UserCreateRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.create(body));
    }

    @GetMapping("/{id}")
    public UserView get(@PathVariable Long id) {
        return userService.get(id);
    }

    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public UserView update(@PathVariable Long id, @Valid @RequestBody UserUpdateRequest body) {
        return userService.update(id, body);
    }

    @DeleteMapping("/{id}")
    public Map<String, Boolean> delete(@PathVariable Long id) {
        userService.delete(id);
        return Map.of("ok", true);
    }
}
