package com.mcr.core.strategy.transform;

import com.mcr.core.error.StrategyDefinitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Name lookup over every {@link TransformFunction} bean.
 */
@Component
public class TransformRegistry {

    private static final Logger log = LoggerFactory.getLogger(TransformRegistry.class);

    private final Map<String, TransformFunction> transforms = new TreeMap<>();

    public TransformRegistry(List<TransformFunction> functions) {
        for (TransformFunction fn : functions) {
            if (transforms.putIfAbsent(fn.name(), fn) != null) {
                throw new StrategyDefinitionException("Transform '" + fn.name() + "' registered twice");
            }
        }
        log.info("Registered transforms: {}", transforms.keySet());
    }

    public TransformFunction get(String name) {
        TransformFunction fn = transforms.get(name);
        if (fn == null) {
            throw new StrategyDefinitionException("Unknown transform: " + name);
        }
        return fn;
    }

    public boolean contains(String name) {
        return transforms.containsKey(name);
    }

    public Set<String> names() {
        return transforms.keySet();
    }
}
