package com.fulqrom.backend.modules.access.presentation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fulqrom.backend.global.error.ProblemException;
import com.fulqrom.backend.modules.access.application.AuthorizationDecision;
import com.fulqrom.backend.modules.access.application.AuthorizationFailure;
import com.fulqrom.backend.modules.access.application.AuthorizationFailureException;
import com.fulqrom.backend.modules.access.application.AuthorizationService;
import com.fulqrom.backend.modules.access.application.PermissionDeniedException;
import com.fulqrom.backend.modules.access.domain.PermissionFlag;
import com.fulqrom.backend.modules.access.presentation.dto.AccessScopeResponse;
import com.fulqrom.backend.modules.access.presentation.dto.AuthorizationCheckRequest;
import com.fulqrom.backend.modules.access.presentation.dto.AuthorizationDecisionResponse;
import com.fulqrom.backend.modules.access.presentation.gate.UserIdentifierExtractor;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

@RestController
@RequestMapping("/authorization")
public class AuthorizationController {

    static final String USERS_MODULE = "users";

    private final AuthorizationService authorizationService;
    private final UserIdentifierExtractor userIdentifierExtractor;

    public AuthorizationController(
            AuthorizationService authorizationService,
            UserIdentifierExtractor userIdentifierExtractor
    ) {
        this.authorizationService = authorizationService;
        this.userIdentifierExtractor = userIdentifierExtractor;
    }

    @Operation(
            summary = "Evaluate a permission",
            description = """
                    Runs the same resolution as the request gate and returns the decision instead of rejecting. \
                    Checking another user's access requires `users` view permission.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Decision, allowed or denied"),
            @ApiResponse(responseCode = "400", description = "Unknown action or missing target"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PostMapping("/check")
    public ResponseEntity<AuthorizationDecisionResponse> check(
            @Valid @RequestBody AuthorizationCheckRequest request,
            HttpServletRequest httpRequest
    ) {
        String subject = resolveSubject(request.userId(), httpRequest);

        AuthorizationDecision decision;
        if (StringUtils.hasText(request.resourceType())) {
            decision = authorizationService.authorizeResource(
                    subject, request.resourceType().trim(), request.action(), request.resourceId());
        } else if (StringUtils.hasText(request.module())) {
            decision = authorizationService.authorizeModule(subject, request.module().trim(), request.action());
        } else {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "authz.target_required",
                    "Either module or resource_type with resource_id is required");
        }
        return ResponseEntity.ok(AuthorizationDecisionResponse.from(decision));
    }

    @Operation(
            summary = "List accessible resources",
            description = """
                    Resources of one type the user may view: full access through a role, or the ids granted \
                    directly. Listing another user's scope requires `users` view permission.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scope of the user"),
            @ApiResponse(responseCode = "400", description = "Missing resource type"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @GetMapping("/scope")
    public ResponseEntity<AccessScopeResponse> scope(
            @RequestParam(name = "resource_type", required = false) String resourceType,
            @RequestParam(name = "user_id", required = false) String userId,
            HttpServletRequest httpRequest
    ) {
        String subject = resolveSubject(userId, httpRequest);
        String type = resourceType == null ? null : resourceType.trim();
        return ResponseEntity.ok(AccessScopeResponse.from(authorizationService.accessScope(subject, type)));
    }

    private String resolveSubject(String requestedUserId, HttpServletRequest httpRequest) {
        String caller = userIdentifierExtractor.extract(httpRequest)
                .orElseThrow(() -> new AuthorizationFailureException(AuthorizationFailure.AUTHENTICATION_REQUIRED));
        if (!StringUtils.hasText(requestedUserId) || requestedUserId.trim().equals(caller)) {
            return caller;
        }
        AuthorizationDecision callerDecision = authorizationService.authorizeModule(
                caller, USERS_MODULE, PermissionFlag.VIEW.action());
        if (!callerDecision.allowed()) {
            throw new PermissionDeniedException(callerDecision);
        }
        return requestedUserId.trim();
    }
}
