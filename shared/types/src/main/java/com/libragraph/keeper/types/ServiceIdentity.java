package com.libragraph.keeper.types;

import java.util.ArrayList;
import java.util.List;

/**
 * Identity of a supervised service: {@code (name, namespace, version)}.
 *
 * <p>Name and namespace are required; version is advisory. Two services are the
 * same service when name and namespace match, regardless of version.
 * Null components are stored as empty strings so that validation can report them.
 */
public record ServiceIdentity(String name, String namespace, String version) {

    public ServiceIdentity {
        name = name == null ? "" : name;
        namespace = namespace == null ? "" : namespace;
        version = version == null ? "" : version;
    }

    public static ServiceIdentity of(String name, String namespace, String version) {
        return new ServiceIdentity(name, namespace, version);
    }

    /**
     * Returns the {@code namespace/name} pair that must be unique within a group.
     */
    public String key() {
        return namespace + "/" + name;
    }

    /**
     * Lists every rule this identity breaks. Empty when the identity is valid.
     */
    public List<String> violations() {
        List<String> violations = new ArrayList<>(2);
        if (name.isEmpty()) {
            violations.add("service name cannot be empty");
        }
        if (namespace.isEmpty()) {
            violations.add("service namespace cannot be empty" + (name.isEmpty() ? "" : " (service '" + name + "')"));
        }
        return violations;
    }

    public boolean isValid() {
        return violations().isEmpty();
    }

    /**
     * Returns true when both identities share the uniqueness key.
     */
    public boolean sameServiceAs(ServiceIdentity other) {
        return other != null && name.equals(other.name) && namespace.equals(other.namespace);
    }

    @Override
    public String toString() {
        return version.isEmpty() ? key() : key() + "@" + version;
    }
}
