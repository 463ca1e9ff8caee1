package com.janus.controller;

import com.janus.service.ModelRegistryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Model catalog in OpenAI list format.
 */
@RestController
@RequestMapping("/v1")
public class ModelsController {

    private final ModelRegistryService modelRegistryService;

    public ModelsController(ModelRegistryService modelRegistryService) {
        this.modelRegistryService = modelRegistryService;
    }

    @GetMapping("/models")
    public Mono<Map<String, Object>> listModels(
            @RequestHeader(value = "x-api-key", required = false) String apiKey,
            @RequestHeader(value = "anthropic-version", required = false) String anthropicVersion) {
        return modelRegistryService.getModels(apiKey, anthropicVersion)
                .map(models -> Map.of("object", "list", "data", models));
    }
}
