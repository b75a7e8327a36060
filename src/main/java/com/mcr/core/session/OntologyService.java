package com.mcr.core.session;

import com.mcr.core.reasoner.ReasonerBackend;
import com.mcr.core.reasoner.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Global ontology rules shared by every session. Loaded once from
 * {@code mcr.ontology.location}; files that fail validation are skipped.
 */
@Service
public class OntologyService {

    private static final Logger log = LoggerFactory.getLogger(OntologyService.class);

    private final List<String> ontologies;

    @Autowired
    public OntologyService(ReasonerBackend reasoner,
                           @Value("${mcr.ontology.location:classpath*:ontologies/*.pl}") String location) {
        this.ontologies = load(reasoner, location);
    }

    OntologyService(List<String> ontologies) {
        this.ontologies = List.copyOf(ontologies);
    }

    public static OntologyService none() {
        return new OntologyService(List.of());
    }

    public String rulesText() {
        return String.join("\n", ontologies);
    }

    public int size() {
        return ontologies.size();
    }

    private static List<String> load(ReasonerBackend reasoner, String location) {
        if (location == null || location.isBlank()) {
            log.info("No ontology location configured");
            return List.of();
        }
        var loaded = new ArrayList<String>();
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(location);
            for (Resource resource : resources) {
                String text = resource.getContentAsString(StandardCharsets.UTF_8);
                ValidationResult validation = reasoner.validate(text);
                if (!validation.valid()) {
                    log.warn("Skipping ontology {}: {}", resource.getFilename(), validation.error());
                    continue;
                }
                loaded.add(text.strip());
                log.info("Loaded ontology {}", resource.getFilename());
            }
        } catch (IOException e) {
            log.warn("Could not read ontologies from {}: {}", location, e.getMessage());
        }
        return Collections.unmodifiableList(loaded);
    }
}
