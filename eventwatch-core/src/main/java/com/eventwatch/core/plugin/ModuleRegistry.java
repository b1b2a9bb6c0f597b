package com.eventwatch.core.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Holds all registered DetectionModules, ordered by their
 * {@link DetectionModule#getOrder()} priority. Fixed after construction.
 */
public class ModuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

    private final List<DetectionModule> modules;
    private final Map<String, DetectionModule> moduleMap;

    public ModuleRegistry(List<DetectionModule> modules) {
        List<DetectionModule> sorted = new ArrayList<>(modules);
        sorted.sort(Comparator.comparingInt(DetectionModule::getOrder));
        this.modules = Collections.unmodifiableList(sorted);
        this.moduleMap = modules.stream()
                .collect(Collectors.toUnmodifiableMap(DetectionModule::getId, Function.identity()));

        log.info("[EventWatch] Registered {} detection modules: {}",
                modules.size(),
                this.modules.stream().map(m -> m.getId() + "(order=" + m.getOrder() + ")")
                        .collect(Collectors.joining(", ")));
    }

    public List<DetectionModule> getModules() {
        return modules;
    }

    public DetectionModule getModule(String id) {
        return moduleMap.get(id);
    }

    public List<DetectionModule> getEnabledModules(ModuleContext context) {
        return modules.stream()
                .filter(m -> m.isEnabled(context))
                .collect(Collectors.toList());
    }

    public boolean hasModule(String id) {
        return moduleMap.containsKey(id);
    }
}
