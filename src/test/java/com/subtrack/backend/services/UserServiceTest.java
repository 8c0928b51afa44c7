package com.subtrack.backend.services;

import com.subtrack.backend.dto.SignUpRequest;
import com.subtrack.backend.exceptions.DuplicateResourceException;
import com.subtrack.backend.exceptions.UnauthorizedException;
import com.subtrack.backend.models.User;
import com.subtrack.backend.repositories.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService(userRepository, passwordEncoder);
    }

    private SignUpRequest signUp(String email) {
        SignUpRequest request = new SignUpRequest();
        request.setName(" Jane Doe ");
        request.setEmail(email);
        request.setPassword("secret123");
        return request;
    }

    @Test
    void register_normalizesEmailAndHashesPassword() {
        when(userRepository.existsByEmail("jane@example.com")).thenReturn(false);
        when(passwordEncoder.encode("secret123")).thenReturn("hashed");
        when(userRepository.saveAndFlush(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));

        User user = userService.register(signUp(" Jane@Example.com "));

        assertThat(user.getEmail()).isEqualTo("jane@example.com");
        assertThat(user.getName()).isEqualTo("Jane Doe");
        assertThat(user.getPassword()).isEqualTo("hashed");
    }

    @Test
    void register_existingEmailIsConflict() {
        when(userRepository.existsByEmail("jane@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.register(signUp("jane@example.com")))
                .isInstanceOf(DuplicateResourceException.class);
        verify(userRepository, never()).save(any());
    }

    @Test
    void register_losingConcurrentSignUpIsConflict() {
        when(userRepository.existsByEmail("jane@example.com")).thenReturn(false);
        when(passwordEncoder.encode("secret123")).thenReturn("hashed");
        when(userRepository.saveAndFlush(any(User.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        assertThatThrownBy(() -> userService.register(signUp("jane@example.com")))
                .isInstanceOf(DuplicateResourceException.class)
                .hasMessage("User already exists");
    }

    @Test
    void currentUser_unknownEmailIsUnauthorized() {
        when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> userService.getCurrentUser("ghost@example.com"))
                .isInstanceOf(UnauthorizedException.class);
    }
}
