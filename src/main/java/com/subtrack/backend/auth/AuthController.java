package com.subtrack.backend.auth;

import com.subtrack.backend.dto.AuthResponse;
import com.subtrack.backend.dto.SignInRequest;
import com.subtrack.backend.dto.SignUpRequest;
import com.subtrack.backend.models.User;
import com.subtrack.backend.services.UserService;
import com.subtrack.backend.util.SubscriptionMapper;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/auth")
@Slf4j
public class AuthController {

    private final AuthenticationManager authenticationManager;
    private final UserService userService;
    private final JwtUtil jwtUtil;

    public AuthController(AuthenticationManager authenticationManager, UserService userService, JwtUtil jwtUtil) {
        this.authenticationManager = authenticationManager;
        this.userService = userService;
        this.jwtUtil = jwtUtil;
    }

    @PostMapping("/sign-up")
    public ResponseEntity<Map<String, Object>> signUp(@Valid @RequestBody SignUpRequest request) {
        User user = userService.register(request);
        String token = jwtUtil.generateToken(user.getEmail());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(body("User created successfully", new AuthResponse(token, SubscriptionMapper.toDto(user))));
    }

    @PostMapping("/sign-in")
    public ResponseEntity<Map<String, Object>> signIn(@Valid @RequestBody SignInRequest request) {
        String email = request.getEmail().trim().toLowerCase();
        Authentication auth = authenticationManager.authenticate(
                new UsernamePasswordAuthenticationToken(email, request.getPassword())
        );

        User user = userService.getCurrentUser(auth.getName());
        String token = jwtUtil.generateToken(user.getEmail());
        log.debug("User {} signed in", user.getId());

        return ResponseEntity.ok(body("User signed in successfully", new AuthResponse(token, SubscriptionMapper.toDto(user))));
    }

    /**
     * Tokens are stateless; signing out is the client discarding its token
     */
    @PostMapping("/sign-out")
    public ResponseEntity<Map<String, Object>> signOut() {
        return ResponseEntity.ok(body("User signed out successfully", null));
    }

    private Map<String, Object> body(String message, Object data) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("message", message);
        if (data != null) {
            body.put("data", data);
        }
        return body;
    }
}
