package com.profilebundler.inheritance;

import com.profilebundler.models.Profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a selection into leaves (no child inside the selection) and internal
 * profiles (at least one other selected profile inherits from them). Only the
 * selection itself is consulted; children outside it do not count.
 */
public final class LeafClassifier {

    private LeafClassifier() {
    }

    public record Classification(List<Profile> leaves, List<Profile> internals) {
        public Classification {
            leaves = Collections.unmodifiableList(new ArrayList<>(leaves));
            internals = Collections.unmodifiableList(new ArrayList<>(internals));
        }

        public boolean hasInternals() {
            return !internals.isEmpty();
        }
    }

    public static Classification classify(List<Profile> selection) {
        List<Profile> leaves = new ArrayList<>();
        List<Profile> internals = new ArrayList<>();
        for (Profile candidate : selection) {
            if (hasChildIn(candidate, selection)) {
                internals.add(candidate);
            } else {
                leaves.add(candidate);
            }
        }
        return new Classification(leaves, internals);
    }

    private static boolean hasChildIn(Profile candidate, List<Profile> selection) {
        for (Profile other : selection) {
            if (other == candidate) {
                continue;
            }
            if (NameResolver.referencesByCoreName(other, candidate.getName())) {
                return true;
            }
        }
        return false;
    }
}
