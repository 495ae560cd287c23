package io.trello.client.association;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The associations of one entity type, by name.
 */
public final class AssociationRegistry {

    private final Map<String, Association<?, ?>> associations;

    private AssociationRegistry(Map<String, Association<?, ?>> associations) {
        this.associations = Collections.unmodifiableMap(associations);
    }

    /**
     * @throws IllegalArgumentException if two associations share a name
     */
    public static AssociationRegistry of(Collection<? extends Association<?, ?>> associations) {
        Map<String, Association<?, ?>> byName = new LinkedHashMap<>();
        for (Association<?, ?> association : associations) {
            if (byName.putIfAbsent(association.getName(), association) != null) {
                throw new IllegalArgumentException("Association '" + association.getName() + "' is declared twice");
            }
        }
        return new AssociationRegistry(byName);
    }

    public Optional<Association<?, ?>> get(String name) {
        return Optional.ofNullable(associations.get(name));
    }

    /**
     * @throws IllegalArgumentException if there is no association with that name
     */
    public Association<?, ?> require(String name) {
        Association<?, ?> association = associations.get(name);
        if (association == null) {
            throw new IllegalArgumentException("Unknown association '" + name + "', expected one of " + associations.keySet());
        }
        return association;
    }

    public Set<String> names() {
        return associations.keySet();
    }
}
