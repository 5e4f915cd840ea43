package com.civicintake.authservice.api;

import com.civicintake.authservice.config.ServiceProperties;
import com.civicintake.authservice.infrastructure.web.GuardRequests;
import com.civicintake.security.guard.AuthorizationGuard;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service info endpoint. Public; names the caller when a valid access credential is presented.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final AuthorizationGuard guard;
    private final Clock clock;

    public ServiceInfoController(ServiceProperties properties, AuthorizationGuard guard, Clock clock) {
        this.properties = properties;
        this.guard = guard;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo(HttpServletRequest http) {
        return guard.<Map<String, Object>>optionalAuthentication((request, principal) -> {
                    Map<String, Object> info = new LinkedHashMap<>();
                    info.put("name", properties.name());
                    info.put("environment", properties.environment());
                    info.put("description", properties.description() != null ? properties.description() : "");
                    info.put("status", "running");
                    info.put("timestamp", clock.instant().toString());
                    if (principal != null) {
                        info.put("authenticatedAs", UserView.of(principal));
                    }
                    return info;
                })
                .handle(GuardRequests.from(http))
                .fold(allowed -> allowed.value(), rejection -> Map.of());
    }
}
