package com.geochat.routing.controller;

import com.geochat.routing.config.ConfigReloadService;
import com.geochat.routing.config.DomainConfigLoader;
import com.geochat.routing.model.ConfigSummary;
import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.RouteRequest;
import com.geochat.routing.model.RoutingResult;
import com.geochat.routing.service.HybridRoutingEngine;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/routing")
@CrossOrigin(origins = "*")  // chat UI
@Slf4j
public class RoutingController {

    private final HybridRoutingEngine engine;
    private final DomainConfigLoader configLoader;
    private final ConfigReloadService reloadService;

    public RoutingController(HybridRoutingEngine engine,
                             DomainConfigLoader configLoader,
                             ConfigReloadService reloadService) {
        this.engine = engine;
        this.configLoader = configLoader;
        this.reloadService = reloadService;
    }

    /**
     * Routes one user question to an analysis endpoint, or explains why it could not.
     * Every outcome, including rejection, is a 200 with a structured result.
     */
    @PostMapping("/route")
    public ResponseEntity<RoutingResult> route(@Valid @RequestBody RouteRequest request) {
        log.info("🔵 Routing question: '{}'", request.getQuestion());
        return ResponseEntity.ok(engine.route(
                request.getQuestion(), request.getConversationContext(), request.getFieldHint()));
    }

    @GetMapping("/config")
    public ResponseEntity<ConfigSummary> config() {
        return ResponseEntity.ok(ConfigSummary.of(configLoader.current()));
    }

    /**
     * Reloads the domain configuration and field inventory. If either document is
     * rejected neither is replaced, and the error is reported as 422.
     */
    @PostMapping("/config/reload")
    public ResponseEntity<ConfigSummary> reload() {
        DomainConfig config = reloadService.reload();
        return ResponseEntity.ok(ConfigSummary.of(config));
    }
}
