package ca.gc.cra.logkit.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AttributesTest {

  @Test
  void pairsStringKeysWithFollowingValues() {
    List<Attribute> attributes = Attributes.normalize("user", "alice", "attempts", 3);

    assertEquals(List.of(new Attribute("user", "alice"), new Attribute("attempts", 3)), attributes);
  }

  @Test
  void keepsAttributeInstancesAndMixesWithPairs() {
    Attribute region = Attribute.string("region", "ca-central");

    List<Attribute> attributes = Attributes.normalize(region, "zone", "b");

    assertEquals(List.of(region, new Attribute("zone", "b")), attributes);
  }

  @Test
  void trailingKeyAndNonStringArgumentsUseBadKey() {
    List<Attribute> attributes = Attributes.normalize(42, "dangling");

    assertEquals(2, attributes.size());
    assertEquals(new Attribute(Attributes.BAD_KEY, 42), attributes.get(0));
    assertEquals(new Attribute(Attributes.BAD_KEY, "dangling"), attributes.get(1));
  }

  @Test
  void nullOrEmptyArgumentsYieldNoAttributes() {
    assertTrue(Attributes.normalize().isEmpty());
    assertTrue(Attributes.normalize((Object[]) null).isEmpty());
  }

  @Test
  void groupCopiesMembers() {
    Attribute group = Attribute.group("request", Attribute.string("id", "r-1"));

    assertTrue(group.isGroup());
    Attribute.Group members = (Attribute.Group) group.value();
    assertEquals(List.of(Attribute.string("id", "r-1")), members.members());
    assertThrows(UnsupportedOperationException.class,
        () -> members.members().add(Attribute.string("x", "y")));
    assertFalse(Attribute.string("a", "b").isGroup());
  }

  @Test
  void concatLeavesInputsUntouched() {
    List<Attribute> base = List.of(Attribute.string("a", "1"));

    List<Attribute> merged = Attributes.concat(base, List.of(Attribute.string("b", "2")));

    assertEquals(1, base.size());
    assertEquals(2, merged.size());
  }
}
