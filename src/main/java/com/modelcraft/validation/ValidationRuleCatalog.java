package com.modelcraft.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AssignableTypeFilter;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Discovers the concrete {@link ValidationRule} subclasses of a package and describes them.
 *
 * <p>{@link #scan()} always re-reads the classpath; {@link #descriptors()} memoizes the first scan.
 */
public class ValidationRuleCatalog {

    private static final Logger log = LoggerFactory.getLogger(ValidationRuleCatalog.class);

    public static final String DEFAULT_PACKAGE = "com.modelcraft.validation.rules";

    private final String basePackage;
    private Map<String, ValidationRuleDescriptor> byName;

    public ValidationRuleCatalog(String basePackage) {
        this.basePackage = basePackage != null && !basePackage.isBlank() ? basePackage : DEFAULT_PACKAGE;
    }

    public ValidationRuleCatalog() {
        this(DEFAULT_PACKAGE);
    }

    /** Every instantiable rule in the package, ordered by name. */
    public List<ValidationRuleDescriptor> scan() {
        var scanner = new ClassPathScanningCandidateComponentProvider(false);
        scanner.addIncludeFilter(new AssignableTypeFilter(ValidationRule.class));

        var result = new ArrayList<ValidationRuleDescriptor>();
        for (var candidate : scanner.findCandidateComponents(basePackage)) {
            describe(candidate.getBeanClassName()).ifPresent(result::add);
        }
        result.sort(Comparator.comparing(ValidationRuleDescriptor::name));
        log.debug("Discovered {} validation rules in {}", result.size(), basePackage);
        return result;
    }

    public List<ValidationRuleDescriptor> descriptors() {
        return List.copyOf(index().values());
    }

    public Optional<ValidationRuleDescriptor> find(String ruleName) {
        return Optional.ofNullable(index().get(ruleName));
    }

    public List<String> names() {
        return List.copyOf(index().keySet());
    }

    /** Forget the memoized scan. */
    public void refresh() {
        byName = null;
    }

    private Map<String, ValidationRuleDescriptor> index() {
        if (byName == null) {
            byName = scan().stream().collect(Collectors.toMap(
                ValidationRuleDescriptor::name, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        }
        return byName;
    }

    private Optional<ValidationRuleDescriptor> describe(String className) {
        try {
            var type = ClassUtils.forName(className, getClass().getClassLoader()).asSubclass(ValidationRule.class);
            var rule = BeanUtils.instantiateClass(type);
            return Optional.of(new ValidationRuleDescriptor(
                ValidationRule.ruleName(type),
                type,
                rule.description(),
                rule.javascriptValidation(),
                rule.applicableFieldTypes()));
        } catch (ClassNotFoundException | LinkageError | RuntimeException e) {
            log.warn("Skipping validation rule {}: {}", className, e.getMessage());
            return Optional.empty();
        }
    }
}
