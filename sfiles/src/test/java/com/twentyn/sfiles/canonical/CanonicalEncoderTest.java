/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.sfiles.canonical;

import com.twentyn.sfiles.EncoderOptions;
import com.twentyn.sfiles.Sfiles;
import com.twentyn.sfiles.SfilesVersion;
import com.twentyn.sfiles.UnencodableGraphException;
import com.twentyn.sfiles.graph.EdgeKind;
import com.twentyn.sfiles.graph.EdgeTags;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.UnitNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CanonicalEncoderTest {

  private static final CanonicalEncoder CANONICAL = new CanonicalEncoder(EncoderOptions.DEFAULT);

  private static String reencode(String text) throws Exception {
    return CANONICAL.encode(Sfiles.parse(text));
  }

  @Test
  public void testSimplePathWithTagIsReproduced() throws Exception {
    String text = "(raw)(r)(hex){hot_in}(sep)(prod)";
    assertEquals("Canonical text encodes to itself", text, reencode(text));
  }

  @Test
  public void testBranchPlacementIsReproduced() throws Exception {
    String text = "(raw)[(r)](hex)(sep)(prod)";
    assertEquals("The shorter path goes into the branch", text, reencode(text));
    assertEquals("Writing the branches the other way round gives the same text",
        text, reencode("(raw)[(hex)(sep)(prod)](r)"));
  }

  @Test
  public void testRecycleUsesLowestMarker() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    UnitNode r = flowsheet.addUnit("r", 1);
    UnitNode sep = flowsheet.addUnit("sep", 1);
    UnitNode prod = flowsheet.addUnit("prod", 1);
    flowsheet.addStream(raw, r);
    flowsheet.addStream(r, sep);
    flowsheet.addStream(sep, r);
    flowsheet.addStream(sep, prod);

    assertEquals("Recycle from sep-1 to r-1 is marked with 1", "(raw)(r)<1(sep)1(prod)", CANONICAL.encode(flowsheet));
  }

  @Test
  public void testElevenOpenRecyclesUseTwoDigitMarkers() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    List<UnitNode> reactors = new ArrayList<>();
    UnitNode previous = raw;
    for (int i = 1; i <= 11; i++) {
      UnitNode r = flowsheet.addUnit("r", i);
      flowsheet.addStream(previous, r);
      reactors.add(r);
      previous = r;
    }
    UnitNode mix = flowsheet.addUnit("mix", 1);
    flowsheet.addStream(previous, mix);
    flowsheet.addStream(mix, flowsheet.addUnit("prod", 1));
    reactors.forEach(r -> flowsheet.addStream(mix, r));

    String expected = "(raw)(r)<1(r)<2(r)<3(r)<4(r)<5(r)<6(r)<7(r)<8(r)<9(r)<%10(r)<%11(mix)123456789%10%11(prod)";
    String encoded = CANONICAL.encode(flowsheet);
    assertEquals("Markers past 9 are written as %##", expected, encoded);
    assertEquals("The text encodes to itself", expected, reencode(encoded));
  }

  @Test
  public void testSecondFeedBecomesIncomingBranch() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode mix = flowsheet.addUnit("mix", 1);
    flowsheet.addStream(flowsheet.addUnit("raw", 1), mix);
    flowsheet.addStream(flowsheet.addUnit("raw", 2), mix);
    flowsheet.addStream(mix, flowsheet.addUnit("prod", 1));

    assertEquals("Feed joining a unit already written is an incoming branch",
        "(raw)<&|(raw)&|(mix)(prod)", CANONICAL.encode(flowsheet));
  }

  @Test
  public void testSignalLinesAndSeparatedComponents() throws Exception {
    String text = "(raw)(pp)(r)<_1(prod)n|(C)_1{sig_q}";
    assertEquals("Signal lines and their tags survive re-encoding", text, reencode(text));
    assertEquals("Signal ends may be written in either order", text, reencode("(C)_1{sig_q}n|(raw)(pp)(r)<_1(prod)"));
  }

  @Test
  public void testTagsOnRecyclesAndIncomingBranches() throws Exception {
    String canonical = "(raw)<&|(raw)&|{1_in}(hex){2_in}[(prod){2_out}](prod){1_out}";
    assertEquals("Tags stay with their streams", canonical, reencode(canonical));
    assertEquals("Pairing the branch with the other feed is the same flowsheet",
        canonical, reencode("(raw)<&|(raw)&|{1_in}(hex){2_in}[(prod){1_out}](prod){2_out}"));
  }

  @Test
  public void testOutputDoesNotDependOnConstructionOrder() throws Exception {
    Flowsheet first = new Flowsheet();
    UnitNode raw = first.addUnit("raw", 1);
    UnitNode splt = first.addUnit("splt", 1);
    UnitNode r = first.addUnit("r", 1);
    UnitNode sep = first.addUnit("sep", 1);
    UnitNode hex = first.addUnit("hex", 1);
    UnitNode prod1 = first.addUnit("prod", 1);
    UnitNode prod2 = first.addUnit("prod", 2);
    first.addStream(raw, splt);
    first.addStream(splt, r);
    first.addStream(r, sep);
    first.addStream(sep, r);
    first.addStream(sep, prod1);
    first.addStream(splt, hex);
    first.addStream(hex, prod2);

    Flowsheet second = new Flowsheet();
    UnitNode prodB = second.addUnit("prod", 7);
    UnitNode hexB = second.addUnit("hex", 3);
    UnitNode prodA = second.addUnit("prod", 2);
    UnitNode sepB = second.addUnit("sep", 5);
    UnitNode rB = second.addUnit("r", 4);
    UnitNode spltB = second.addUnit("splt", 9);
    UnitNode rawB = second.addUnit("raw", 8);
    second.addStream(hexB, prodB);
    second.addStream(spltB, hexB);
    second.addStream(sepB, prodA);
    second.addStream(sepB, rB);
    second.addStream(rB, sepB);
    second.addStream(spltB, rB);
    second.addStream(rawB, spltB);

    String encoded = CANONICAL.encode(first);
    assertEquals("Relabeled and reordered flowsheet encodes identically", encoded, CANONICAL.encode(second));
    assertEquals("Encoding is repeatable", encoded, CANONICAL.encode(first));
    assertEquals("Canonical text encodes to itself", encoded, reencode(encoded));
  }

  @Test
  public void testNonCanonicalKeepsWrittenOrder() throws Exception {
    String text = "(raw)[(hex)(sep)(prod)](r)";
    CanonicalEncoder plain = new CanonicalEncoder(EncoderOptions.builder().setCanonical(false).build());
    assertEquals("Parsed order is kept", text, plain.encode(Sfiles.parse(text)));
    assertEquals("Canonical order differs", "(raw)[(r)](hex)(sep)(prod)", reencode(text));
  }

  @Test
  public void testSubNodeNumbering() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode hex1 = flowsheet.addUnit("hex", 1, 1);
    UnitNode hex2 = flowsheet.addUnit("hex", 1, 2);
    flowsheet.addStream(flowsheet.addUnit("raw", 1), hex1);
    flowsheet.addStream(hex1, flowsheet.addUnit("prod", 1));
    flowsheet.addStream(flowsheet.addUnit("raw", 2), hex2);
    flowsheet.addStream(hex2, flowsheet.addUnit("prod", 2));

    assertEquals("Sub-nodes keep their family and stream labels",
        "(raw)(hex-1/1)(prod)n|(raw)(hex-1/2)(prod)", CANONICAL.encode(flowsheet));
    CanonicalEncoder generalized = new CanonicalEncoder(EncoderOptions.builder().setRemoveNumbering(true).build());
    assertEquals("Without numbering only types are written",
        "(raw)(hex)(prod)n|(raw)(hex)(prod)", generalized.encode(flowsheet));
  }

  @Test
  public void testVersionOneOmitsTags() throws Exception {
    CanonicalEncoder v1 = new CanonicalEncoder(EncoderOptions.builder().setVersion(SfilesVersion.V1).build());
    assertEquals("Only the tags are lost", "(raw)(r)(hex)(sep)(prod)",
        v1.encode(Sfiles.parse("(raw)(r)(hex){hot_in}(sep)(prod)")));
  }

  @Test
  public void testVersionOneSplitsMultiStreamExchangers() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode hex = flowsheet.addUnit("hex", 1);
    UnitNode raw1 = flowsheet.addUnit("raw", 1);
    UnitNode raw2 = flowsheet.addUnit("raw", 2);
    flowsheet.addStream(raw1, hex, EdgeTags.fromEntries(Arrays.asList("1_in")));
    flowsheet.addStream(raw2, hex, EdgeTags.fromEntries(Arrays.asList("2_in")));
    flowsheet.addStream(hex, flowsheet.addUnit("prod", 1), EdgeTags.fromEntries(Arrays.asList("1_out")));
    flowsheet.addStream(hex, flowsheet.addUnit("prod", 2), EdgeTags.fromEntries(Arrays.asList("2_out")));

    CanonicalEncoder v1 = new CanonicalEncoder(EncoderOptions.builder().setVersion(SfilesVersion.V1).build());
    assertEquals("Each stream pair becomes its own sub-node",
        "(raw)(hex-1/1)(prod)n|(raw)(hex-1/2)(prod)", v1.encode(flowsheet));
    assertTrue("The input is left alone", flowsheet.getUnitByName("hex-1") != null);
  }

  @Test(expected = UnencodableGraphException.class)
  public void testDuplicateStreamIsUnencodable() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    UnitNode prod = flowsheet.addUnit("prod", 1);
    flowsheet.addStream(raw, prod);
    flowsheet.addStream(raw, prod);
    CANONICAL.encode(flowsheet);
  }

  @Test(expected = UnencodableGraphException.class)
  public void testComponentWithoutStartIsUnencodable() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode r = flowsheet.addUnit("r", 1);
    UnitNode sep = flowsheet.addUnit("sep", 1);
    flowsheet.addStream(r, sep);
    flowsheet.addStream(sep, r);
    CANONICAL.encode(flowsheet);
  }

  @Test(expected = UnencodableGraphException.class)
  public void testTooManyOpenRecyclesIsUnencodable() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode previous = flowsheet.addUnit("raw", 1);
    List<UnitNode> reactors = new ArrayList<>();
    for (int i = 1; i <= 100; i++) {
      UnitNode r = flowsheet.addUnit("r", i);
      flowsheet.addStream(previous, r);
      reactors.add(r);
      previous = r;
    }
    UnitNode mix = flowsheet.addUnit("mix", 1);
    flowsheet.addStream(previous, mix);
    reactors.forEach(r -> flowsheet.addStream(mix, r));
    CANONICAL.encode(flowsheet);
  }

  @Test
  public void testUnitsReachedOnlyFromACycleWithoutSourceAreWritten() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    UnitNode mix = flowsheet.addUnit("mix", 1);
    UnitNode prod = flowsheet.addUnit("prod", 1);
    UnitNode r1 = flowsheet.addUnit("r", 1);
    UnitNode r2 = flowsheet.addUnit("r", 2);
    flowsheet.addStream(raw, mix);
    flowsheet.addStream(mix, prod);
    flowsheet.addStream(r1, r2);
    flowsheet.addStream(r2, r1);
    flowsheet.addStream(r1, mix);

    String encoded = CANONICAL.encode(flowsheet);
    assertEquals("The cycle gets a line of its own", "(raw)(mix)<1(prod)n|(r)1<1(r)1", encoded);
    Flowsheet reparsed = Sfiles.parse(encoded);
    assertEquals("No unit is lost", 5, reparsed.size());
    assertEquals("No stream is lost", 5, reparsed.getStreams().size());
    assertEquals("The text encodes to itself", encoded, CANONICAL.encode(reparsed));

    flowsheet.addSignal(r2, prod);
    Flowsheet withSignal = Sfiles.parse(CANONICAL.encode(flowsheet));
    assertEquals("Signals may end on units of such a line", 1, withSignal.getStreams(EdgeKind.SIGNAL).size());
  }

  @Test
  public void testTiedCandidatesWithDifferentFeedsAreStable() throws Exception {
    String canonical = Sfiles.canonicalize("(hex)[<&|(prod)&|(r)]<&|(raw)&|(r)");
    assertEquals("Canonical text canonicalizes to itself", canonical, Sfiles.canonicalize(canonical));
    assertEquals("Swapping which reactor each feed joins is the same flowsheet",
        canonical, Sfiles.canonicalize("(hex)[<&|(raw)&|(r)]<&|(prod)&|(r)"));
  }

  @Test
  public void testSignalOnEitherTwinEncodesIdentically() throws Exception {
    String first = CANONICAL.encode(twinsWithSignal(true));
    String second = CANONICAL.encode(twinsWithSignal(false));
    assertEquals("Which twin carries the signal does not matter", first, second);
    assertEquals("The text encodes to itself", first, reencode(first));
  }

  private static Flowsheet twinsWithSignal(boolean onFirst) {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    UnitNode r1 = flowsheet.addUnit("r", 1);
    UnitNode r2 = flowsheet.addUnit("r", 2);
    flowsheet.addStream(raw, r1);
    flowsheet.addStream(raw, r2);
    flowsheet.addSignal(raw, onFirst ? r1 : r2);
    return flowsheet;
  }

  @Test
  public void testTagsOnRecyclesDoNotDependOnNumbering() throws Exception {
    String first = CANONICAL.encode(crossTagged(false));
    String second = CANONICAL.encode(crossTagged(true));
    assertEquals("Swapping the numbers of the two receiving units gives the same text", first, second);
    assertEquals("The text encodes to itself", first, reencode(first));
  }

  private static Flowsheet crossTagged(boolean swapped) {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode head = flowsheet.addUnit("r", 1);
    UnitNode tail = flowsheet.addUnit("r", 2);
    UnitNode top = flowsheet.addUnit("raw", swapped ? 2 : 1);
    UnitNode plain = flowsheet.addUnit("raw", swapped ? 1 : 2);
    if (swapped) {
      flowsheet.addStream(head, plain);
      flowsheet.addStream(head, top);
    } else {
      flowsheet.addStream(head, top);
      flowsheet.addStream(head, plain);
    }
    flowsheet.addStream(head, tail, EdgeTags.fromEntries(Arrays.asList("bottom_out", "x_z")));
    flowsheet.addStream(tail, top, EdgeTags.fromEntries(Arrays.asList("top_out")));
    flowsheet.addStream(tail, plain);
    return flowsheet;
  }

  @Test(timeout = 30000)
  public void testCrossedTrainsEncodeQuickly() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    UnitNode a = raw;
    UnitNode b = raw;
    int rungs = 30;
    for (int i = 1; i <= rungs; i++) {
      UnitNode nextA = flowsheet.addUnit("r", 2 * i - 1);
      UnitNode nextB = flowsheet.addUnit("r", 2 * i);
      flowsheet.addStream(a, nextA);
      if (a != b) {
        flowsheet.addStream(a, nextB);
        flowsheet.addStream(b, nextA);
      }
      flowsheet.addStream(b, nextB);
      a = nextA;
      b = nextB;
    }
    UnitNode prod = flowsheet.addUnit("prod", 1);
    flowsheet.addStream(a, prod);
    flowsheet.addStream(b, prod);

    String encoded = CANONICAL.encode(flowsheet);
    Flowsheet reparsed = Sfiles.parse(encoded);
    assertEquals("Every unit is written", 2 * rungs + 2, reparsed.size());
    assertEquals("The text encodes to itself", encoded, CANONICAL.encode(reparsed));
  }

  @Test
  public void testRandomFlowsheetsEncodeTheSameInAnyOrder() throws Exception {
    Random random = new Random(20170);
    for (int i = 0; i < 300; i++) {
      RandomFlowsheet generated = RandomFlowsheet.generate(random);
      Flowsheet first = generated.build(random);
      Flowsheet second = generated.build(random);

      String encoded = CANONICAL.encode(first);
      String description = String.format("flowsheet %d (%s)", i, encoded);
      assertEquals("Insertion order does not matter for " + description, encoded, CANONICAL.encode(second));

      Flowsheet reparsed = Sfiles.parse(encoded);
      assertEquals("Units survive for " + description, first.size(), reparsed.size());
      assertEquals("Material streams survive for " + description,
          first.getStreams(EdgeKind.MATERIAL).size(), reparsed.getStreams(EdgeKind.MATERIAL).size());
      assertEquals("Signals survive for " + description,
          first.getStreams(EdgeKind.SIGNAL).size(), reparsed.getStreams(EdgeKind.SIGNAL).size());
      assertEquals("Canonical text encodes to itself for " + description, encoded, CANONICAL.encode(reparsed));
    }
  }

  /**
   * A flowsheet kept as plain lists, so the same one can be built with units and streams added in any order.  Every
   * unit is reached from one of the feeds or from a two-unit cycle hanging off the rest.
   */
  private static class RandomFlowsheet {
    private static final String[] TYPES = {"r", "sep", "mix", "hex"};
    private static final List<List<String>> TAGS = Arrays.asList(
        Collections.emptyList(), Collections.emptyList(), Collections.emptyList(),
        Arrays.asList("x_z"), Arrays.asList("bottom_out"), Arrays.asList("top_out", "x_z"));

    private final List<String> types = new ArrayList<>();
    private final List<int[]> material = new ArrayList<>();
    private final List<List<String>> tags = new ArrayList<>();
    private final List<int[]> signals = new ArrayList<>();
    private final Set<List<Integer>> taken = new HashSet<>();

    static RandomFlowsheet generate(Random random) {
      RandomFlowsheet g = new RandomFlowsheet();
      int feeds = 1 + random.nextInt(2);
      int inner = 2 + random.nextInt(5);
      for (int i = 0; i < feeds; i++) {
        g.types.add("raw");
      }
      for (int i = 0; i < inner; i++) {
        g.types.add(TYPES[random.nextInt(TYPES.length)]);
      }
      for (int v = feeds; v < feeds + inner; v++) {
        g.addMaterial(random.nextInt(v), v, random);
      }
      int extra = random.nextInt(inner + 1);
      for (int i = 0; i < extra; i++) {
        int u = feeds + random.nextInt(inner);
        int v = feeds + random.nextInt(inner);
        if (u != v) {
          g.addMaterial(u, v, random);
        }
      }
      if (random.nextBoolean()) {
        int c1 = g.types.size();
        int c2 = c1 + 1;
        g.types.add("pp");
        g.types.add(TYPES[random.nextInt(TYPES.length)]);
        g.addMaterial(c1, c2, random);
        g.addMaterial(c2, c1, random);
        g.addMaterial(random.nextBoolean() ? c1 : c2, feeds + random.nextInt(inner), random);
      }
      int signalCount = random.nextInt(3);
      for (int i = 0; i < signalCount; i++) {
        int u = random.nextInt(g.types.size());
        int v = random.nextInt(g.types.size());
        if (u != v && g.taken.add(Arrays.asList(u, v, 1))) {
          g.signals.add(new int[]{u, v});
        }
      }
      return g;
    }

    private void addMaterial(int source, int target, Random random) {
      if (taken.add(Arrays.asList(source, target, 0))) {
        material.add(new int[]{source, target});
        tags.add(TAGS.get(random.nextInt(TAGS.size())));
      }
    }

    Flowsheet build(Random random) {
      int n = types.size();
      List<Integer> unitOrder = shuffled(n, random);
      Flowsheet flowsheet = new Flowsheet();
      UnitNode[] units = new UnitNode[n];
      Map<String, Integer> counters = new HashMap<>();
      for (int u : unitOrder) {
        units[u] = flowsheet.addUnit(types.get(u), counters.merge(types.get(u), 1, Integer::sum));
      }
      for (int s : shuffled(material.size() + signals.size(), random)) {
        if (s < material.size()) {
          int[] e = material.get(s);
          flowsheet.addStream(units[e[0]], units[e[1]], EdgeTags.fromEntries(tags.get(s)));
        } else {
          int[] e = signals.get(s - material.size());
          flowsheet.addSignal(units[e[0]], units[e[1]]);
        }
      }
      return flowsheet;
    }

    private static List<Integer> shuffled(int size, Random random) {
      List<Integer> order = new ArrayList<>(size);
      for (int i = 0; i < size; i++) {
        order.add(i);
      }
      Collections.shuffle(order, random);
      return order;
    }
  }
}
