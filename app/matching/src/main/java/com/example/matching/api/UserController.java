package com.example.matching.api;

import com.example.matching.api.request.UserCreateRequest;
import com.example.matching.api.request.UserPatchRequest;
import com.example.matching.api.response.UserResponse;
import com.example.matching.service.UserService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** プロフィール API。本人の識別は X-User-Id のみで行う。 */
@RestController
@RequestMapping("/v1/users")
@RequiredArgsConstructor
public class UserController {

  private final UserService userService;

  @PostMapping("/me")
  public ResponseEntity<UserResponse> create(
      @RequestHeader(UserIdHeader.NAME) UUID userId,
      @Valid @RequestBody UserCreateRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(userService.create(userId, request));
  }

  @GetMapping("/me")
  public UserResponse me(@RequestHeader(UserIdHeader.NAME) UUID userId) {
    return userService.get(userId);
  }

  @GetMapping("/{user_id}")
  public UserResponse get(
      // 他人のプロフィール参照も認証済みであることは要求する
      @RequestHeader(UserIdHeader.NAME) UUID requesterId, @PathVariable("user_id") UUID userId) {
    return userService.get(userId);
  }

  @PatchMapping("/me")
  public UserResponse patch(
      @RequestHeader(UserIdHeader.NAME) UUID userId,
      @Valid @RequestBody UserPatchRequest request) {
    return userService.patch(userId, request);
  }
}
