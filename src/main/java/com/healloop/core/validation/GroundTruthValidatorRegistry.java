package com.healloop.core.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Maps tool names to {@link ToolValidator}s.
 * <p>
 * A tool without a validator, or a {@code null} value, yields no issues. A validator that
 * throws yields a single issue describing the exception, so validation never breaks an
 * execution.
 */
@Component
public class GroundTruthValidatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(GroundTruthValidatorRegistry.class);

    private final Map<String, ToolValidator> validators = new ConcurrentHashMap<>();

    public GroundTruthValidatorRegistry(List<ToolValidator> discovered) {
        for (ToolValidator validator : discovered) {
            for (String tool : validator.tools()) {
                validators.put(tool, validator);
            }
        }
        log.info("Ground-truth validators registered for tools: {}", validators.keySet());
    }

    /** Registers a result-only validator, replacing any existing one for {@code tool}. */
    public void register(String tool, Function<Object, List<String>> resultCheck) {
        validators.put(tool, new ToolValidator() {
            @Override
            public Set<String> tools() {
                return Set.of(tool);
            }

            @Override
            public List<String> validateResult(Object result) {
                return resultCheck.apply(result);
            }
        });
    }

    public void register(ToolValidator validator) {
        validator.tools().forEach(tool -> validators.put(tool, validator));
    }

    boolean hasValidator(String tool) {
        return validators.containsKey(tool);
    }

    public Set<String> registeredTools() {
        return Set.copyOf(validators.keySet());
    }

    public List<String> validateResult(String tool, Object result) {
        ToolValidator validator = validators.get(tool);
        if (validator == null || result == null) {
            return List.of();
        }
        try {
            return nonNull(validator.validateResult(result));
        } catch (Exception e) {
            log.warn("Result validator for {} threw: {}", tool, e.toString());
            return List.of("Validator error: " + e.getMessage());
        }
    }

    public List<String> validateParameters(String tool, Map<String, Object> params) {
        ToolValidator validator = validators.get(tool);
        if (validator == null || params == null) {
            return List.of();
        }
        try {
            return nonNull(validator.validateParameters(params));
        } catch (Exception e) {
            log.warn("Parameter validator for {} threw: {}", tool, e.toString());
            return List.of("Validator error: " + e.getMessage());
        }
    }

    private static List<String> nonNull(List<String> issues) {
        return issues == null ? List.of() : List.copyOf(issues);
    }
}
