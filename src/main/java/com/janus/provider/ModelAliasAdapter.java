package com.janus.provider;

import com.janus.config.JanusProperties;
import com.janus.model.MessagesRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes configured canonical model names (for example {@code claude-3-5-sonnet-20241022}) to a
 * managed provider. The target's transpiler maps the model, so the alias is echoed back unchanged.
 */
@Slf4j
@Order(4)
@Component
public class ModelAliasAdapter implements ProviderAdapter {

    private final Map<String, String> aliases;
    private final Map<String, AbstractProviderAdapter> targets = new LinkedHashMap<>();

    public ModelAliasAdapter(JanusProperties properties, List<AbstractProviderAdapter> adapters) {
        this.aliases = properties.getRouting().getAliases();
        for (AbstractProviderAdapter adapter : adapters) {
            targets.put(adapter.getName(), adapter);
        }
        aliases.forEach((model, target) -> {
            if (!targets.containsKey(target)) {
                log.warn("Alias {} points to unknown provider {}, ignoring it", model, target);
            }
        });
    }

    @Override
    public String getName() {
        return "alias";
    }

    @Override
    public boolean supports(String model) {
        AbstractProviderAdapter target = targetFor(model);
        return target != null && target.isEnabled();
    }

    @Override
    public Mono<Void> handle(MessagesRequest request, ServerWebExchange exchange) {
        AbstractProviderAdapter target = targetFor(request.getModel());
        if (target == null) {
            return Mono.error(new IllegalStateException("No alias target for model " + request.getModel()));
        }
        log.debug("Alias {} resolved to provider {}", request.getModel(), target.getName());
        return target.handle(request, exchange);
    }

    private AbstractProviderAdapter targetFor(String model) {
        String target = model != null ? aliases.get(model) : null;
        return target != null ? targets.get(target) : null;
    }
}
