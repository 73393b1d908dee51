package com.profilebundler;

import com.profilebundler.inheritance.InheritanceGraph;
import com.profilebundler.models.Profile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a directory and a {@link ProfileFilter} into the concrete profile
 * selection the operations work on.
 */
public class ProfileSelector {

    private final ProfileStore store;

    public ProfileSelector(ProfileStore store) {
        this.store = store;
    }

    public List<Profile> select(Path profileDir, ProfileFilter filter) {
        List<Profile> all = store.loadProfiles(List.of(profileDir), filter.getType());
        List<Profile> selected = all.stream()
            .filter(filter::matches)
            .collect(Collectors.toList());
        log("Selected " + selected.size() + " of " + all.size() + " " + filter.getType() + " profile(s)"
            + (filter.describe().isEmpty() ? "" : " matching " + String.join(", ", filter.describe())));
        return selected;
    }

    /**
     * The selection followed by every profile of {@code corpus} that descends from it
     * and is not already selected.
     */
    public List<Profile> withDescendants(List<Profile> selection, List<Profile> corpus) {
        Set<String> seeds = new LinkedHashSet<>();
        Set<String> selectedKeys = new LinkedHashSet<>();
        for (Profile profile : selection) {
            seeds.add(profile.getName());
            selectedKeys.add(key(profile));
        }
        List<Profile> expanded = new ArrayList<>(selection);
        int added = 0;
        for (Profile descendant : InheritanceGraph.descendants(corpus, seeds)) {
            if (selectedKeys.add(key(descendant))) {
                expanded.add(descendant);
                added++;
            }
        }
        log("Included " + added + " descendant profile(s)");
        return expanded;
    }

    private static String key(Profile profile) {
        return profile.getSourceFile() + "|" + profile.getName();
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[ProfileSelector] " + message);
        }
    }
}
