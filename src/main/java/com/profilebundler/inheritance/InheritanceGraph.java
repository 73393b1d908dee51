package com.profilebundler.inheritance;

import com.profilebundler.models.Profile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Child-to-parent edges over an arbitrary set of loaded profiles. Edges are
 * derived on demand from {@code inherits} values; every walk is guarded by a
 * visited set so circular references terminate.
 *
 * When several profiles share a name, the first one in the supplied order wins.
 */
public final class InheritanceGraph {

    private InheritanceGraph() {
    }

    public static List<Profile> directChildren(Collection<Profile> profiles, String parentName) {
        List<Profile> children = new ArrayList<>();
        for (Profile profile : profiles) {
            if (NameResolver.inheritsFrom(profile, parentName)) {
                children.add(profile);
            }
        }
        return children;
    }

    /**
     * Breadth-first closure of {@link #directChildren} starting from {@code seedNames}.
     * Each profile appears once, in first-discovery order.
     */
    public static List<Profile> descendants(Collection<Profile> profiles, Collection<String> seedNames) {
        Map<String, Profile> found = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(seedNames);

        while (!queue.isEmpty()) {
            String parentName = queue.poll();
            if (!visited.add(parentName)) {
                continue;
            }
            for (Profile child : directChildren(profiles, parentName)) {
                if (found.containsKey(child.getName())) {
                    continue;
                }
                found.put(child.getName(), child);
                queue.add(child.getName());
            }
        }
        return new ArrayList<>(found.values());
    }

    /**
     * First profile the child inherits from, never the child itself.
     *
     * @return the parent, or null when the reference cannot be resolved
     */
    public static Profile findParent(Profile child, Collection<Profile> allProfiles) {
        if (child == null || child.getInherits() == null) {
            return null;
        }
        for (Profile candidate : allProfiles) {
            if (candidate != child && NameResolver.inheritsFrom(child, candidate.getName())) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Ancestors from the direct parent up to the root. Stops at the first
     * reference that cannot be resolved or that closes a cycle.
     */
    public static List<Profile> ancestorChain(Profile profile, Collection<Profile> allProfiles) {
        List<Profile> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(profile.getName());

        Profile current = findParent(profile, allProfiles);
        while (current != null && visited.add(current.getName())) {
            chain.add(current);
            current = findParent(current, allProfiles);
        }
        return chain;
    }
}
