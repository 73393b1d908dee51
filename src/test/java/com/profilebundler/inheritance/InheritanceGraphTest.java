package com.profilebundler.inheritance;

import com.profilebundler.models.Profile;
import com.profilebundler.models.ProfileType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InheritanceGraphTest {

    private static Profile profile(String name, String inherits) {
        Profile profile = new Profile(null, ProfileType.PRINT, "print: " + name);
        profile.setInherits(inherits);
        return profile;
    }

    private static List<String> names(List<Profile> profiles) {
        return profiles.stream().map(Profile::getName).collect(Collectors.toList());
    }

    @Test
    void descendantsAreBreadthFirstAndUnique() {
        Profile a = profile("A", null);
        Profile b = profile("B", "A");
        Profile c = profile("C", "B");
        Profile d = profile("D", "print: A");
        List<Profile> all = List.of(a, b, c, d);

        List<Profile> descendants = InheritanceGraph.descendants(all, List.of("print: A"));

        assertEquals(List.of("print: B", "print: D", "print: C"), names(descendants));
    }

    @Test
    void cyclesTerminate() {
        Profile x = profile("X", "Y");
        Profile y = profile("Y", "X");
        List<Profile> all = List.of(x, y);

        List<Profile> descendants = InheritanceGraph.descendants(all, List.of("print: X"));
        assertEquals(List.of("print: Y", "print: X"), names(descendants));

        assertEquals(List.of("print: Y"), names(InheritanceGraph.ancestorChain(x, all)));
    }

    @Test
    void findParentNeverReturnsTheChildItself() {
        Profile self = profile("Self", "Self");
        assertNull(InheritanceGraph.findParent(self, List.of(self)));
    }

    @Test
    void ancestorChainStopsAtUnresolvedReference() {
        Profile a = profile("A", "Missing");
        Profile b = profile("B", "A");
        Profile c = profile("C", "B");

        assertEquals(List.of("print: B", "print: A"), names(InheritanceGraph.ancestorChain(c, List.of(a, b, c))));
        assertTrue(InheritanceGraph.ancestorChain(a, List.of(a, b, c)).isEmpty());
    }

    @Test
    void firstMatchingProfileWins() {
        Profile first = profile("Base", null);
        first.putProperty("layer_height", "0.2");
        Profile second = profile("Base", null);
        second.putProperty("layer_height", "0.3");
        Profile child = profile("Child", "Base");

        assertSame(first, InheritanceGraph.findParent(child, List.of(first, second, child)));
    }
}
