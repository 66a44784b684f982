package fk.treestats.aggregation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.validation.ConstraintViolation;
import javax.validation.Validation;
import javax.validation.Validator;
import javax.validation.ValidatorFactory;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads and validates {@link StatsConfig} from json.
 */
public class StatsConfigManager {

    private static final Logger logger = LoggerFactory.getLogger(StatsConfigManager.class);

    static final String DEFAULT_CONFIG_RESOURCE = "treestats-conf.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    private StatsConfigManager() {
    }

    public static StatsConfig loadConfig(String path) throws IOException {
        StatsConfig config = validate(mapper.readValue(new File(path), StatsConfig.class));
        logger.info("Loaded config from {}: threshold: {}, sort: {}, topN: {}",
            path, config.getThreshold(), config.isSortChildren(), config.getRankingTopN());
        return config;
    }

    public static StatsConfig loadConfig(InputStream in) throws IOException {
        return validate(mapper.readValue(in, StatsConfig.class));
    }

    /**
     * Loads the config bundled with this module.
     */
    public static StatsConfig loadDefaultConfig() throws IOException {
        try (InputStream in = StatsConfigManager.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if(in == null) {
                throw new IOException("Resource not found: " + DEFAULT_CONFIG_RESOURCE);
            }
            return loadConfig(in);
        }
    }

    static StatsConfig validate(StatsConfig config) {
        Set<ConstraintViolation<StatsConfig>> violations;
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            violations = validator.validate(config);
        }
        if(!violations.isEmpty()) {
            String message = violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid config: " + message);
        }
        return config;
    }
}
