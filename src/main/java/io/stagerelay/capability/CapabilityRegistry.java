package io.stagerelay.capability;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class CapabilityRegistry {
    private final Map<String, Capability> capabilities = new ConcurrentHashMap<>();

    public CapabilityRegistry register(Capability capability) {
        capabilities.put(capability.kind(), capability);
        return this;
    }

    public CapabilityRegistry registerAll(Collection<? extends Capability> values) {
        for (Capability capability : values) {
            register(capability);
        }
        return this;
    }

    public Optional<Capability> findByKind(String kind) {
        return Optional.ofNullable(capabilities.get(kind));
    }

    public List<String> listKinds() {
        return List.copyOf(new TreeSet<>(capabilities.keySet()));
    }
}
