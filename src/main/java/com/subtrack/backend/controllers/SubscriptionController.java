package com.subtrack.backend.controllers;

import com.subtrack.backend.dto.CreateSubscriptionRequest;
import com.subtrack.backend.dto.SubscriptionDto;
import com.subtrack.backend.dto.UpdateSubscriptionRequest;
import com.subtrack.backend.models.User;
import com.subtrack.backend.services.SubscriptionService;
import com.subtrack.backend.services.UserService;
import com.subtrack.backend.util.SubscriptionMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final UserService userService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> createSubscription(
            @AuthenticationPrincipal UserDetails userDetails,
            @Valid @RequestBody CreateSubscriptionRequest request) {
        User user = userService.getCurrentUser(userDetails.getUsername());
        SubscriptionService.CreatedSubscription created = subscriptionService.createSubscription(request, user);

        Map<String, Object> body = body("Subscription created successfully", SubscriptionMapper.toDto(created.subscription()));
        body.put("workflowRunId", created.workflowRunId());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/user/{id}")
    public ResponseEntity<Map<String, Object>> getUserSubscriptions(
            @AuthenticationPrincipal UserDetails userDetails,
            @PathVariable Long id) {
        User user = userService.getCurrentUser(userDetails.getUsername());
        List<SubscriptionDto> subscriptions = subscriptionService.getUserSubscriptions(id, user).stream()
                .map(SubscriptionMapper::toDto)
                .toList();
        return ResponseEntity.ok(body("Subscriptions fetched successfully", subscriptions));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getSubscription(
            @AuthenticationPrincipal UserDetails userDetails,
            @PathVariable Long id) {
        User user = userService.getCurrentUser(userDetails.getUsername());
        return ResponseEntity.ok(body("Subscription fetched successfully",
                SubscriptionMapper.toDto(subscriptionService.getSubscription(id, user))));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> updateSubscription(
            @AuthenticationPrincipal UserDetails userDetails,
            @PathVariable Long id,
            @Valid @RequestBody UpdateSubscriptionRequest request) {
        User user = userService.getCurrentUser(userDetails.getUsername());
        return ResponseEntity.ok(body("Subscription updated successfully",
                SubscriptionMapper.toDto(subscriptionService.updateSubscription(id, request, user))));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deleteSubscription(
            @AuthenticationPrincipal UserDetails userDetails,
            @PathVariable Long id) {
        User user = userService.getCurrentUser(userDetails.getUsername());
        return ResponseEntity.ok(body("Subscription deleted successfully",
                SubscriptionMapper.toDto(subscriptionService.deleteSubscription(id, user))));
    }

    private Map<String, Object> body(String message, Object data) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("message", message);
        body.put("data", data);
        return body;
    }
}
