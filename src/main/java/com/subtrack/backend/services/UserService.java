package com.subtrack.backend.services;

import com.subtrack.backend.dto.SignUpRequest;
import com.subtrack.backend.exceptions.DuplicateResourceException;
import com.subtrack.backend.exceptions.ResourceNotFoundException;
import com.subtrack.backend.exceptions.UnauthorizedException;
import com.subtrack.backend.models.User;
import com.subtrack.backend.repositories.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Transactional
    public User register(SignUpRequest request) {
        String email = request.getEmail().trim().toLowerCase();
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateResourceException("User already exists");
        }

        User user = User.builder()
                .name(request.getName().trim())
                .email(email)
                .password(passwordEncoder.encode(request.getPassword()))
                .build();

        User saved;
        try {
            // flush now so a concurrent sign-up with the same email fails here, not at commit
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent registration for the same email lost the race: {}", e.getMostSpecificCause().getMessage());
            throw new DuplicateResourceException("User already exists");
        }
        log.info("Registered user {}", saved.getId());
        return saved;
    }

    /**
     * Resolve the authenticated principal to its user row
     */
    @Transactional(readOnly = true)
    public User getCurrentUser(String email) {
        if (email == null) {
            throw new UnauthorizedException("Unauthorized");
        }
        return userRepository.findByEmail(email.toLowerCase())
                .orElseThrow(() -> new UnauthorizedException("Unauthorized"));
    }

    @Transactional(readOnly = true)
    public List<User> getUsers() {
        return userRepository.findAll();
    }

    @Transactional(readOnly = true)
    public User getUser(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }
}
