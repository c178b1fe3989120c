package com.example.matching.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserCreateRequest(
    @NotBlank(message = "name is required") @Size(max = 255, message = "name is too long")
        String name,
    @NotBlank(message = "gender is required") String gender,
    @NotNull(message = "birth_date is required") @Past(message = "birth_date must be in the past")
        LocalDate birthDate,
    String bio) {}
