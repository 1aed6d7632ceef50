package com.example.EV_Charging_Platform.controller;

import com.example.EV_Charging_Platform.model.ProviderHealth;
import com.example.EV_Charging_Platform.provider.ProviderAdapter;
import com.example.EV_Charging_Platform.provider.ProviderRegistry;
import com.example.EV_Charging_Platform.service.ProviderHealthTracker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/v1/providers")
@CrossOrigin(origins = "*")
public class ProviderHealthController {

    private final ProviderRegistry registry;
    private final ProviderHealthTracker healthTracker;

    public ProviderHealthController(ProviderRegistry registry, ProviderHealthTracker healthTracker) {
        this.registry = registry;
        this.healthTracker = healthTracker;
    }

    /**
     * GET /api/v1/providers/health, one entry per configured provider
     */
    @GetMapping("/health")
    public ResponseEntity<List<ProviderHealth>> health() {
        List<ProviderHealth> health = new ArrayList<>();
        for (ProviderAdapter adapter : registry.all()) {
            health.add(healthTracker.health(adapter.name()));
        }
        return ResponseEntity.ok(health);
    }
}
