package com.care.backoffice.dto;

import com.care.backoffice.entity.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateRequest {

    @Email(message = "Enter a valid email")
    private String email;

    private Optional<@Size(min = 1, max = 100, message = "Name must be between 1 and 100 characters") String> name;

    private Role role;

    @Size(min = 6, message = "Password must be at least 6 characters")
    private String password;
}
