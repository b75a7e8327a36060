package com.mcr.core.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mcr.core.error.McrException;
import com.mcr.core.error.StrategyDefinitionException;
import com.mcr.core.error.StrategyNotFoundException;
import com.mcr.core.router.InputClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Strategy graphs known to this process, keyed by id and by content hash.
 * <p>
 * The hash is the SHA-256 of the graph's canonical JSON form, so two files
 * describing the same graph share a hash and any edit to a graph changes it.
 * Performance records refer to strategies by this hash.
 */
@Service
public class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final ObjectMapper objectMapper;
    private final ObjectMapper canonicalMapper;
    private final StrategyProperties properties;
    private final Map<String, StrategyGraph> byId = new ConcurrentHashMap<>();
    private final Map<String, String> hashById = new ConcurrentHashMap<>();
    private final Map<String, String> idByHash = new ConcurrentHashMap<>();

    public StrategyRegistry(ObjectMapper objectMapper, StrategyProperties properties) {
        this.objectMapper = objectMapper;
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
        this.properties = properties;
        loadAll(properties.getLocation());
    }

    private void loadAll(String location) {
        if (location == null || location.isBlank()) {
            log.info("No strategy location configured");
            return;
        }
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(location);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    StrategyGraph graph = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
                    register(graph);
                } catch (McrException | IOException e) {
                    log.error("Skipping strategy file {}: {}", resource.getFilename(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Cannot list strategies at {}: {}", location, e.getMessage());
        }
        log.info("Loaded {} strategies: {}", byId.size(), byId.keySet());
    }

    /**
     * Parses a strategy graph from JSON. Structural violations, including
     * unknown step kinds, surface as {@link StrategyDefinitionException}.
     */
    public StrategyGraph parse(String json) {
        try {
            return objectMapper.readValue(json, StrategyGraph.class);
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StrategyDefinitionException sde) {
                throw sde;
            }
            throw new StrategyDefinitionException("Invalid strategy definition: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Adds or replaces a graph and returns its hash.
     */
    public String register(StrategyGraph graph) {
        String hash = hash(graph);
        String previous = hashById.put(graph.getId(), hash);
        if (previous != null && !previous.equals(hash)) {
            idByHash.remove(previous);
            log.warn("Strategy {} redefined (hash {} -> {})", graph.getId(), shortHash(previous), shortHash(hash));
        }
        byId.put(graph.getId(), graph);
        idByHash.put(hash, graph.getId());
        log.debug("Registered strategy {} with hash {}", graph.getId(), shortHash(hash));
        return hash;
    }

    public StrategyGraph get(String strategyId) {
        StrategyGraph graph = byId.get(strategyId);
        if (graph == null) {
            throw new StrategyNotFoundException(strategyId);
        }
        return graph;
    }

    public Optional<StrategyGraph> findByHash(String hash) {
        if (hash == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(idByHash.get(hash)).map(byId::get);
    }

    public String hashOf(String strategyId) {
        String hash = hashById.get(strategyId);
        if (hash == null) {
            throw new StrategyNotFoundException(strategyId);
        }
        return hash;
    }

    public List<StrategyGraph> all() {
        var graphs = new ArrayList<>(byId.values());
        graphs.sort((a, b) -> a.getId().compareTo(b.getId()));
        return graphs;
    }

    public List<StrategyGraph> forInput(InputClass inputClass) {
        return all().stream().filter(g -> g.getInputType() == inputClass).toList();
    }

    /**
     * The configured fallback strategy for an input class.
     */
    public StrategyGraph defaultFor(InputClass inputClass) {
        String id = inputClass == InputClass.QUERY ? properties.getDefaultQuery() : properties.getDefaultAssert();
        return get(id);
    }

    public int size() {
        return byId.size();
    }

    /**
     * SHA-256 over the canonical JSON of the graph, hex encoded.
     */
    public String hash(StrategyGraph graph) {
        try {
            Object tree = canonicalMapper.convertValue(graph, Object.class);
            byte[] canonical = canonicalMapper.writeValueAsBytes(tree);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new StrategyDefinitionException("Cannot hash strategy " + graph.getId() + ": " + e.getMessage(), e);
        }
    }

    private static String shortHash(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
