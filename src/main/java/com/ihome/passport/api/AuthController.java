package com.ihome.passport.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import com.ihome.passport.api.dto.ApiResponse;
import com.ihome.passport.api.dto.LoginRequest;
import com.ihome.passport.api.dto.RegisterRequest;
import com.ihome.passport.api.dto.SessionNameResponse;
import com.ihome.passport.exception.ErrorCode;
import com.ihome.passport.service.AuthService;
import com.ihome.passport.session.HttpSessionContext;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 通行证 API 控制器。
 * <p>
 * 暴露 REST 接口：注册（`POST /users`）、登录（`POST /session`）、查询登录状态（`GET /session`）、登出（`DELETE /session`）。
 * 登录态保存在 Servlet 会话中，通过 {@link HttpSessionContext} 显式传入业务层。
 */
@RestController
@RequestMapping("/api/v1.0")
@RequiredArgsConstructor
@Validated
public class AuthController {

    private final AuthService authService;
    private final ClientAddressResolver clientAddressResolver;

    @PostMapping("/users")
    public ApiResponse<Void> register(@Valid @RequestBody RegisterRequest request, HttpServletRequest httpRequest) {
        authService.register(request, clientAddressResolver.resolve(httpRequest), new HttpSessionContext(httpRequest));
        return ApiResponse.ok("注册成功");
    }

    @PostMapping("/session")
    public ApiResponse<Void> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        authService.login(request, clientAddressResolver.resolve(httpRequest), new HttpSessionContext(httpRequest));
        return ApiResponse.ok("登录成功");
    }

    @GetMapping("/session")
    public ApiResponse<SessionNameResponse> checkLogin(HttpServletRequest httpRequest) {
        return authService.checkStatus(new HttpSessionContext(httpRequest))
                .map(view -> ApiResponse.ok("true", new SessionNameResponse(view.displayName())))
                .orElseGet(() -> ApiResponse.error(ErrorCode.SESSION_NOT_FOUND, "false"));
    }

    @DeleteMapping("/session")
    public ApiResponse<Void> logout(HttpServletRequest httpRequest) {
        authService.logout(new HttpSessionContext(httpRequest));
        return ApiResponse.ok("ok");
    }
}
