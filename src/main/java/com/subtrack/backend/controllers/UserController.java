package com.subtrack.backend.controllers;

import com.subtrack.backend.dto.UserDto;
import com.subtrack.backend.services.UserService;
import com.subtrack.backend.util.SubscriptionMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping
    public ResponseEntity<Map<String, Object>> getUsers() {
        List<UserDto> users = userService.getUsers().stream()
                .map(SubscriptionMapper::toDto)
                .toList();
        return ResponseEntity.ok(Map.of("success", true, "data", users));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getUser(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("success", true, "data", SubscriptionMapper.toDto(userService.getUser(id))));
    }
}
