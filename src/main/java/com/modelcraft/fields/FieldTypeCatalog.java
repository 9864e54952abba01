package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;
import com.modelcraft.validation.ValidationRuleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AssignableTypeFilter;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Discovers the concrete {@link FieldBase} subclasses of a package. Each class is probed once with
 * a throw-away descriptor to read its UI component and default operators.
 */
public class FieldTypeCatalog {

    private static final Logger log = LoggerFactory.getLogger(FieldTypeCatalog.class);

    public static final String DEFAULT_PACKAGE = "com.modelcraft.fields";

    private final String basePackage;
    private final ValidationRuleCatalog ruleCatalog;
    private Map<String, FieldTypeDescriptor> byType;

    public FieldTypeCatalog(String basePackage, ValidationRuleCatalog ruleCatalog) {
        this.basePackage = basePackage != null && !basePackage.isBlank() ? basePackage : DEFAULT_PACKAGE;
        this.ruleCatalog = ruleCatalog;
    }

    public FieldTypeCatalog(ValidationRuleCatalog ruleCatalog) {
        this(DEFAULT_PACKAGE, ruleCatalog);
    }

    /** Every instantiable field type in the package, ordered by type name. */
    public List<FieldTypeDescriptor> scan() {
        var scanner = new ClassPathScanningCandidateComponentProvider(false);
        scanner.addIncludeFilter(new AssignableTypeFilter(FieldBase.class));

        var rules = ruleCatalog.scan();
        var result = new ArrayList<FieldTypeDescriptor>();
        for (var candidate : scanner.findCandidateComponents(basePackage)) {
            describe(candidate.getBeanClassName()).ifPresent(type -> result.add(new FieldTypeDescriptor(
                type.type(),
                type.implementingClass(),
                type.description(),
                type.uiComponent(),
                type.operators(),
                rules.stream().filter(rule -> rule.appliesTo(type.type())).toList())));
        }
        result.sort(Comparator.comparing(FieldTypeDescriptor::type));
        log.debug("Discovered {} field types in {}", result.size(), basePackage);
        return result;
    }

    public List<FieldTypeDescriptor> descriptors() {
        return List.copyOf(index().values());
    }

    public Optional<FieldTypeDescriptor> find(String type) {
        return Optional.ofNullable(index().get(type));
    }

    public boolean isKnownType(String type) {
        return index().containsKey(type);
    }

    public List<String> typeNames() {
        return List.copyOf(index().keySet());
    }

    /** Forget the memoized scan. */
    public void refresh() {
        byType = null;
    }

    /** "DateTimeField" becomes "date time field". */
    static String describeClassName(String simpleName) {
        return Arrays.stream(simpleName.split("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])"))
            .map(word -> word.toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(" "));
    }

    private Map<String, FieldTypeDescriptor> index() {
        if (byType == null) {
            var index = new LinkedHashMap<String, FieldTypeDescriptor>();
            scan().forEach(descriptor -> index.putIfAbsent(descriptor.type(), descriptor));
            byType = index;
        }
        return byType;
    }

    private Optional<FieldTypeDescriptor> describe(String className) {
        try {
            var type = ClassUtils.forName(className, getClass().getClassLoader()).asSubclass(FieldBase.class);
            var constructor = ClassUtils.getConstructorIfAvailable(type, FieldDescriptor.class);
            if (constructor == null) {
                log.warn("Skipping field type {}: no public (FieldDescriptor) constructor", className);
                return Optional.empty();
            }
            var typeName = FieldBase.typeName(type);
            var probe = BeanUtils.instantiateClass(constructor, FieldDescriptor.builder("probe", typeName).build());
            return Optional.of(new FieldTypeDescriptor(
                typeName,
                type,
                describeClassName(type.getSimpleName()),
                probe.uiComponent(),
                probe.operators(),
                List.of()));
        } catch (ClassNotFoundException | LinkageError | RuntimeException e) {
            log.warn("Skipping field type {}: {}", className, e.getMessage());
            return Optional.empty();
        }
    }
}
