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

package com.twentyn.sfiles.heatintegration;

import com.twentyn.sfiles.AmbiguousHeatIntegrationException;
import com.twentyn.sfiles.EncoderOptions;
import com.twentyn.sfiles.Sfiles;
import com.twentyn.sfiles.graph.EdgeTags;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.HeatIntegrationTag;
import com.twentyn.sfiles.graph.Port;
import com.twentyn.sfiles.graph.StreamEdge;
import com.twentyn.sfiles.graph.UnitNode;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class HeatIntegrationNormalizerTest {

  /**
   * Two feeds each heated in one half of an exchanger.  With swapped set, the first feed is recorded on the second
   * sub-node and the units are added in a different order.
   */
  private static Flowsheet subNodeFlowsheet(boolean swapped) {
    Flowsheet flowsheet = new Flowsheet();
    if (!swapped) {
      UnitNode raw1 = flowsheet.addUnit("raw", 1);
      UnitNode raw2 = flowsheet.addUnit("raw", 2);
      UnitNode hex1 = flowsheet.addUnit("hex", 1, 1);
      UnitNode hex2 = flowsheet.addUnit("hex", 1, 2);
      UnitNode prod1 = flowsheet.addUnit("prod", 1);
      UnitNode prod2 = flowsheet.addUnit("prod", 2);
      flowsheet.addStream(raw1, hex1);
      flowsheet.addStream(hex1, prod1);
      flowsheet.addStream(raw2, hex2);
      flowsheet.addStream(hex2, prod2);
    } else {
      UnitNode hex1 = flowsheet.addUnit("hex", 1, 1);
      UnitNode prod2 = flowsheet.addUnit("prod", 2);
      UnitNode hex2 = flowsheet.addUnit("hex", 1, 2);
      UnitNode raw2 = flowsheet.addUnit("raw", 2);
      UnitNode prod1 = flowsheet.addUnit("prod", 1);
      UnitNode raw1 = flowsheet.addUnit("raw", 1);
      flowsheet.addStream(hex2, prod1);
      flowsheet.addStream(raw2, hex1);
      flowsheet.addStream(hex1, prod2);
      flowsheet.addStream(raw1, hex2);
    }
    return flowsheet;
  }

  private static EdgeTags tags(String... entries) {
    return EdgeTags.fromEntries(Arrays.asList(entries));
  }

  @Test
  public void testMergeIsIndependentOfRecordingOrder() throws Exception {
    Flowsheet first = HeatIntegrationNormalizer.merge(subNodeFlowsheet(false));
    Flowsheet second = HeatIntegrationNormalizer.merge(subNodeFlowsheet(true));

    List<String> names = first.getUnits().stream().map(UnitNode::getName).collect(Collectors.toList());
    assertEquals("Sub-nodes collapse into one exchanger",
        Arrays.asList("raw-1", "raw-2", "hex-1", "prod-1", "prod-2"), names);
    assertEquals("Both recordings merge to the same size", first.size(), second.size());

    String expected = "(raw)<&|(raw)&|{1_in}(hex){2_in}[(prod){2_out}](prod){1_out}";
    assertEquals("First recording encodes canonically", expected, Sfiles.encode(first, EncoderOptions.DEFAULT));
    assertEquals("Second recording encodes identically", expected, Sfiles.encode(second, EncoderOptions.DEFAULT));
  }

  @Test
  public void testMergeDefaultsStreamIdsToSubIndex() throws Exception {
    Flowsheet merged = HeatIntegrationNormalizer.merge(subNodeFlowsheet(false));

    int hex = merged.getUnitByName("hex-1").getId();
    List<String> entering = merged.getInStreams(hex).stream()
        .map(e -> e.getTags().getHeatIntegration().get(0).toText()).collect(Collectors.toList());
    assertEquals("Entering streams are tagged with the sub-node they came from", Arrays.asList("1_in", "2_in"),
        entering);
    assertTrue("Merged exchanger counts as multi-stream",
        HeatIntegrationNormalizer.isMultiStream(merged, merged.getUnit(hex)));
  }

  @Test
  public void testMergeKeepsExplicitTags() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    UnitNode hex1 = flowsheet.addUnit("hex", 1, 1);
    UnitNode hex2 = flowsheet.addUnit("hex", 1, 2);
    UnitNode prod = flowsheet.addUnit("prod", 1);
    flowsheet.addStream(raw, hex1, tags("hot_in"));
    flowsheet.addStream(hex1, hex2, tags("hot_out", "cold_in"));
    flowsheet.addStream(hex2, prod, tags("cold_out"));

    Flowsheet merged = HeatIntegrationNormalizer.merge(flowsheet);
    assertEquals("The exchanger passing a stream through itself is one unit", 3, merged.size());
    StreamEdge loop = merged.getOutStreams(merged.getUnitByName("hex-1").getId()).stream()
        .filter(StreamEdge::isSelfLoop).findFirst().get();
    assertEquals("Named streams survive the merge", Arrays.asList("hot_out", "cold_in"), loop.getTags().toEntries());
  }

  @Test
  public void testMergeLeavesFamilyAloneWhenStreamsWouldCoincide() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    UnitNode hex1 = flowsheet.addUnit("hex", 1, 1);
    UnitNode hex2 = flowsheet.addUnit("hex", 1, 2);
    flowsheet.addStream(raw, hex1);
    flowsheet.addStream(raw, hex2);
    flowsheet.addStream(hex1, flowsheet.addUnit("prod", 1));
    flowsheet.addStream(hex2, flowsheet.addUnit("prod", 2));

    Flowsheet merged = HeatIntegrationNormalizer.merge(flowsheet);
    assertEquals("Nothing is merged", flowsheet.size(), merged.size());
    assertTrue("Sub-nodes are kept", merged.findUnit("hex-1/2").isPresent());
  }

  @Test(expected = AmbiguousHeatIntegrationException.class)
  public void testMergeRejectsSubNodeWithTwoStreams() throws Exception {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    UnitNode hex1 = flowsheet.addUnit("hex", 1, 1);
    flowsheet.addStream(raw, hex1, tags("1_in"));
    flowsheet.addStream(hex1, flowsheet.addUnit("prod", 1), tags("2_out"));
    HeatIntegrationNormalizer.merge(flowsheet);
  }

  @Test
  public void testSplitUndoesMerge() throws Exception {
    Flowsheet merged = HeatIntegrationNormalizer.merge(subNodeFlowsheet(false));
    Flowsheet split = HeatIntegrationNormalizer.split(merged);

    assertTrue("First sub-node is restored", split.findUnit("hex-1/1").isPresent());
    assertTrue("Second sub-node is restored", split.findUnit("hex-1/2").isPresent());
    assertEquals("Each sub-node takes one stream pair", 1,
        split.getInStreams(split.getUnitByName("hex-1/2").getId()).size());
    assertEquals("Splitting then merging again gives the same encoding",
        Sfiles.encode(merged, EncoderOptions.DEFAULT),
        Sfiles.encode(HeatIntegrationNormalizer.merge(split), EncoderOptions.DEFAULT));
  }

  @Test
  public void testSplitRejectsIncompletePair() {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode hex = flowsheet.addUnit("hex", 1);
    flowsheet.addStream(flowsheet.addUnit("raw", 1), hex, tags("1_in"));
    flowsheet.addStream(flowsheet.addUnit("raw", 2), hex, tags("2_in"));
    flowsheet.addStream(hex, flowsheet.addUnit("prod", 1), tags("1_out"));
    flowsheet.addStream(hex, flowsheet.addUnit("prod", 2));

    try {
      HeatIntegrationNormalizer.split(flowsheet);
      fail("Expected split to fail on an incomplete pair");
    } catch (AmbiguousHeatIntegrationException e) {
      assertEquals("The exchanger is named", "hex-1", e.getUnit());
    }
  }

  @Test
  public void testValidateRejectsThreeStreamsOnOneId() {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode hex = flowsheet.addUnit("hex", 1);
    for (int i = 1; i <= 3; i++) {
      flowsheet.addStream(flowsheet.addUnit("raw", i), hex, tags("1_in"));
    }
    flowsheet.addStream(hex, flowsheet.addUnit("prod", 1), tags("1_out"));

    try {
      HeatIntegrationNormalizer.validate(flowsheet);
      fail("Expected three streams on one id to be rejected");
    } catch (AmbiguousHeatIntegrationException e) {
      assertEquals("The exchanger is named", "hex-1", e.getUnit());
      assertEquals("The stream id is named", "1", e.getStream());
    }
  }

  @Test
  public void testExchangerOfFollowsPort() {
    Flowsheet flowsheet = new Flowsheet();
    UnitNode raw = flowsheet.addUnit("raw", 1);
    UnitNode hex = flowsheet.addUnit("hex", 1);
    StreamEdge edge = flowsheet.addStream(raw, hex, tags("1_in"));

    assertEquals("Entering tags refer to the target", hex.getId(),
        HeatIntegrationNormalizer.exchangerOf(edge, new HeatIntegrationTag("1", Port.IN)));
    assertEquals("Leaving tags refer to the source", raw.getId(),
        HeatIntegrationNormalizer.exchangerOf(edge, new HeatIntegrationTag("1", Port.OUT)));
  }

  @Test
  public void testStreamOrderPutsNumbersFirst() {
    List<String> ids = Arrays.asList("hot", "10", "2", "cold");
    ids.sort(HeatIntegrationNormalizer.STREAM_ORDER);
    assertEquals("Numbered ids sort numerically before named ones", Arrays.asList("2", "10", "cold", "hot"), ids);
  }
}
