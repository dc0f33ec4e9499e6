package io.lighting.stencil.fragment;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class FragmentResolvers {
    private FragmentResolvers() {
    }

    public static FragmentResolver none() {
        return name -> Optional.empty();
    }

    public static FragmentResolver of(Collection<Fragment> fragments) {
        Objects.requireNonNull(fragments, "fragments");
        Map<String, Fragment> byName = new LinkedHashMap<>();
        for (Fragment fragment : fragments) {
            if (byName.putIfAbsent(fragment.name(), fragment) != null) {
                throw new IllegalArgumentException("Duplicate fragment name: " + fragment.name());
            }
        }
        return of(byName);
    }

    public static FragmentResolver of(Map<String, Fragment> fragments) {
        Map<String, Fragment> copy = Map.copyOf(fragments);
        return name -> Optional.ofNullable(copy.get(name));
    }

    public static FragmentResolver of(Fragment... fragments) {
        return of(List.of(fragments));
    }
}
