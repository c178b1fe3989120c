package com.example.matching.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.matching.api.response.UserResponse;
import com.example.matching.service.UserService;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(UserController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class UserControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-00000000000a");
  private static final UUID BOB = UUID.fromString("00000000-0000-0000-0000-00000000000b");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private UserService userService;

  @Test
  void createReturns201() throws Exception {
    when(userService.create(eq(ALICE), any())).thenReturn(alice("hi"));

    mockMvc
        .perform(
            post("/v1/users/me")
                .header(UserIdHeader.NAME, ALICE.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"name\":\"Alice\",\"gender\":\"female\",\"birth_date\":\"1995-04-01\",\"bio\":\"hi\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(ALICE.toString()))
        .andExpect(jsonPath("$.birth_date").value("1995-04-01"));
  }

  @Test
  void createTwiceReturns409() throws Exception {
    when(userService.create(eq(ALICE), any())).thenThrow(new UserAlreadyExistsException());

    mockMvc
        .perform(
            post("/v1/users/me")
                .header(UserIdHeader.NAME, ALICE.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Alice\",\"gender\":\"female\",\"birth_date\":\"1995-04-01\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("USER_ALREADY_EXISTS"));
  }

  @Test
  void createWithoutNameReturns400() throws Exception {
    mockMvc
        .perform(
            post("/v1/users/me")
                .header(UserIdHeader.NAME, ALICE.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"gender\":\"female\",\"birth_date\":\"1995-04-01\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("name is required"));
    verifyNoInteractions(userService);
  }

  @Test
  void getOtherUserReturns404WhenMissing() throws Exception {
    when(userService.get(BOB)).thenThrow(new UserNotFoundException());

    mockMvc
        .perform(get("/v1/users/{user_id}", BOB).header(UserIdHeader.NAME, ALICE.toString()))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("user not found"));
  }

  @Test
  void getMeReturnsProfile() throws Exception {
    when(userService.get(ALICE)).thenReturn(alice(null));

    mockMvc
        .perform(get("/v1/users/me").header(UserIdHeader.NAME, ALICE.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Alice"));
  }

  @Test
  void patchUpdatesBio() throws Exception {
    when(userService.patch(eq(ALICE), any())).thenReturn(alice("new bio"));

    mockMvc
        .perform(
            patch("/v1/users/me")
                .header(UserIdHeader.NAME, ALICE.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"bio\":\"new bio\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.bio").value("new bio"));
  }

  private UserResponse alice(String bio) {
    return new UserResponse(ALICE, "Alice", "female", LocalDate.of(1995, 4, 1), bio, NOW, NOW);
  }
}
