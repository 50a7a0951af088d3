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
import com.twentyn.sfiles.graph.EdgeKind;
import com.twentyn.sfiles.graph.EdgeTags;
import com.twentyn.sfiles.graph.Flowsheet;
import com.twentyn.sfiles.graph.HeatIntegrationTag;
import com.twentyn.sfiles.graph.Port;
import com.twentyn.sfiles.graph.StreamEdge;
import com.twentyn.sfiles.graph.UnitNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Brings heat exchangers that serve several stream pairs into a shape the encoder can handle.
 *
 * A multi-stream exchanger can be written either as one unit whose streams are tagged with stream pair ids
 * ("1_in", "1_out", "2_in", ...), or as a family of sub-nodes "hex-1/1", "hex-1/2", each carrying exactly one pair.
 * {@link #merge} goes from the second form to the first, {@link #split} the other way.  Neither guesses: tags that do
 * not pair up raise {@link AmbiguousHeatIntegrationException}.
 */
public class HeatIntegrationNormalizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(HeatIntegrationNormalizer.class);

  /**
   * Numbered streams in numeric order, then named streams alphabetically.
   */
  public static final Comparator<String> STREAM_ORDER = (a, b) -> {
    boolean aNumbered = StringUtils.isNumeric(a);
    boolean bNumbered = StringUtils.isNumeric(b);
    if (aNumbered && bNumbered) {
      return Integer.compare(Integer.parseInt(a), Integer.parseInt(b));
    }
    if (aNumbered != bNumbered) {
      return aNumbered ? -1 : 1;
    }
    return a.compareTo(b);
  };

  private HeatIntegrationNormalizer() {
  }

  /**
   * The exchanger a tag refers to: the target of a stream entering it, the source of a stream leaving it.
   */
  public static int exchangerOf(StreamEdge edge, HeatIntegrationTag tag) {
    return tag.getPort() == Port.IN ? edge.getTarget() : edge.getSource();
  }

  /**
   * Checks that every stream id of every exchanger is used by at most one entering and one leaving stream.  Sub-nodes
   * of one exchanger share their stream ids.
   *
   * @param flowsheet The flowsheet to check.
   * @throws AmbiguousHeatIntegrationException naming the first exchanger and stream id that do not pair up.
   */
  public static void validate(Flowsheet flowsheet) throws AmbiguousHeatIntegrationException {
    Map<Pair<String, String>, int[]> usage = new LinkedHashMap<>();
    for (StreamEdge edge : flowsheet.getStreams()) {
      for (HeatIntegrationTag tag : edge.getTags().getHeatIntegration()) {
        String family = flowsheet.getUnit(exchangerOf(edge, tag)).getFamilyName();
        int[] counts = usage.computeIfAbsent(Pair.of(family, tag.getStream()), k -> new int[2]);
        counts[tag.getPort().ordinal()]++;
      }
    }

    for (Map.Entry<Pair<String, String>, int[]> entry : usage.entrySet()) {
      int in = entry.getValue()[Port.IN.ordinal()];
      int out = entry.getValue()[Port.OUT.ordinal()];
      if (in > 1 || out > 1) {
        String family = entry.getKey().getLeft();
        String stream = entry.getKey().getRight();
        throw new AmbiguousHeatIntegrationException(
            String.format("Heat integration stream %s of %s is used by %d streams (%d in, %d out); " +
                "a stream pair has at most one of each", stream, family, in + out, in, out), family, stream);
      }
    }
  }

  /**
   * Stream ids a unit's own tags refer to, in order of appearance.
   */
  public static Set<String> streamIdsOf(Flowsheet flowsheet, int unit) {
    Set<String> ids = new LinkedHashSet<>();
    for (StreamEdge edge : flowsheet.getInStreams(unit)) {
      edge.getTags().getHeatIntegration().stream()
          .filter(t -> t.getPort() == Port.IN).forEach(t -> ids.add(t.getStream()));
    }
    for (StreamEdge edge : flowsheet.getOutStreams(unit)) {
      edge.getTags().getHeatIntegration().stream()
          .filter(t -> t.getPort() == Port.OUT).forEach(t -> ids.add(t.getStream()));
    }
    return ids;
  }

  public static boolean isMultiStream(Flowsheet flowsheet, UnitNode unit) {
    return !unit.isSubNode() && streamIdsOf(flowsheet, unit.getId()).size() > 1;
  }

  /**
   * Collapses every family of exchanger sub-nodes into one unit.  Streams of sub-node s that carry no heat
   * integration tag for it are tagged with the sub-node's own stream id, or with s if it has none.
   *
   * A family whose merge would put two streams of the same kind between one ordered pair of units is left as it is;
   * this is logged, not raised, because the result is still encodable.
   *
   * @param flowsheet The flowsheet to merge; it is not modified.
   * @return A new flowsheet.
   * @throws AmbiguousHeatIntegrationException if a sub-node refers to more than one stream id, or the merged tags do
   * not pair up.
   */
  public static Flowsheet merge(Flowsheet flowsheet) throws AmbiguousHeatIntegrationException {
    int n = flowsheet.size();
    int[] representative = new int[n];
    for (int i = 0; i < n; i++) {
      representative[i] = i;
    }
    Map<Integer, String> subNodeStream = new HashMap<>();
    Set<Integer> mergedUnits = new HashSet<>();

    // Families in order of their first sub-node.
    Map<String, List<UnitNode>> families = new LinkedHashMap<>();
    flowsheet.getUnits().stream().filter(UnitNode::isSubNode)
        .forEach(u -> families.computeIfAbsent(u.getFamilyName(), k -> new ArrayList<>()).add(u));

    for (Map.Entry<String, List<UnitNode>> family : families.entrySet()) {
      List<UnitNode> subNodes = family.getValue();
      for (UnitNode sub : subNodes) {
        Set<String> ids = streamIdsOf(flowsheet, sub.getId());
        if (ids.size() > 1) {
          throw new AmbiguousHeatIntegrationException(
              String.format("Sub-node %s carries several heat integration streams %s", sub.getName(), ids),
              family.getKey(), StringUtils.join(ids, ","));
        }
        subNodeStream.put(sub.getId(), ids.isEmpty() ? String.valueOf(sub.getSubIndex()) : ids.iterator().next());
      }

      int head = subNodes.get(0).getId();
      subNodes.forEach(u -> representative[u.getId()] = head);
      Triple<Integer, Integer, EdgeKind> duplicate = findDuplicate(flowsheet, representative, head);
      if (duplicate != null) {
        LOGGER.warn("Not merging sub-nodes of %s: merged unit would have two %s streams between %s and %s",
            family.getKey(), duplicate.getRight(), flowsheet.getUnit(duplicate.getLeft()).getFamilyName(),
            flowsheet.getUnit(duplicate.getMiddle()).getFamilyName());
        subNodes.forEach(u -> representative[u.getId()] = u.getId());
        continue;
      }
      subNodes.forEach(u -> mergedUnits.add(u.getId()));
    }

    Flowsheet result = new Flowsheet();
    int[] newId = new int[n];
    for (UnitNode u : flowsheet.getUnits()) {
      if (representative[u.getId()] != u.getId()) {
        continue;
      }
      UnitNode added = mergedUnits.contains(u.getId()) ?
          result.addUnit(u.getType(), u.getIndex()) : result.addUnit(u.getType(), u.getIndex(), u.getSubIndex());
      newId[u.getId()] = added.getId();
    }

    for (StreamEdge edge : flowsheet.getStreams()) {
      EdgeTags tags = edge.getTags();
      if (mergedUnits.contains(edge.getTarget())) {
        tags = withDefaultTag(tags, subNodeStream.get(edge.getTarget()), Port.IN);
      }
      if (mergedUnits.contains(edge.getSource())) {
        tags = withDefaultTag(tags, subNodeStream.get(edge.getSource()), Port.OUT);
      }
      result.addStream(newId[representative[edge.getSource()]], newId[representative[edge.getTarget()]],
          edge.getKind(), tags);
    }

    LOGGER.debug("Merged %d sub-nodes into %d units", mergedUnits.size(), result.size());
    validate(result);
    return result;
  }

  private static EdgeTags withDefaultTag(EdgeTags tags, String stream, Port port) {
    boolean tagged = tags.getHeatIntegration().stream().anyMatch(t -> t.getPort() == port);
    if (tagged) {
      return tags;
    }
    List<HeatIntegrationTag> heatIntegration = new ArrayList<>(tags.getHeatIntegration());
    heatIntegration.add(new HeatIntegrationTag(stream, port));
    return tags.withHeatIntegration(heatIntegration);
  }

  /**
   * Looks for two streams of one kind between the same ordered pair of units once sub-nodes are replaced by their
   * representatives, considering only streams at the given unit.
   */
  private static Triple<Integer, Integer, EdgeKind> findDuplicate(Flowsheet flowsheet, int[] representative,
                                                                  int unit) {
    Set<Triple<Integer, Integer, EdgeKind>> seen = new HashSet<>();
    for (StreamEdge edge : flowsheet.getStreams()) {
      Triple<Integer, Integer, EdgeKind> key =
          Triple.of(representative[edge.getSource()], representative[edge.getTarget()], edge.getKind());
      if (key.getLeft() != unit && key.getMiddle() != unit) {
        continue;
      }
      if (!seen.add(key)) {
        return key;
      }
    }
    return null;
  }

  /**
   * Decomposes every unit whose streams use two or more stream ids into one sub-node per stream id.  Each sub-node
   * takes exactly the streams of its id; signal lines of a split unit attach to its first sub-node.
   *
   * @param flowsheet The flowsheet to split; it is not modified.
   * @return A new flowsheet.
   * @throws AmbiguousHeatIntegrationException if a split unit has an untagged material stream, or one of its stream
   * ids is not a complete entering/leaving pair.
   */
  public static Flowsheet split(Flowsheet flowsheet) throws AmbiguousHeatIntegrationException {
    Map<Integer, List<String>> splitStreams = new HashMap<>();
    for (UnitNode u : flowsheet.getUnits()) {
      if (!isMultiStream(flowsheet, u)) {
        continue;
      }
      Set<String> sorted = new TreeSet<>(STREAM_ORDER);
      sorted.addAll(streamIdsOf(flowsheet, u.getId()));
      List<String> ids = new ArrayList<>(sorted);
      checkCompletePairs(flowsheet, u, ids);
      splitStreams.put(u.getId(), ids);
    }

    Flowsheet result = new Flowsheet();
    Map<Pair<Integer, String>, Integer> subNodeIds = new HashMap<>();
    int[] newId = new int[flowsheet.size()];
    for (UnitNode u : flowsheet.getUnits()) {
      List<String> ids = splitStreams.get(u.getId());
      if (ids == null) {
        newId[u.getId()] = result.addUnit(u.getType(), u.getIndex(), u.getSubIndex()).getId();
        continue;
      }
      for (int i = 0; i < ids.size(); i++) {
        UnitNode sub = result.addUnit(u.getType(), u.getIndex(), i + 1);
        subNodeIds.put(Pair.of(u.getId(), ids.get(i)), sub.getId());
        if (i == 0) {
          newId[u.getId()] = sub.getId();
        }
      }
    }

    for (StreamEdge edge : flowsheet.getStreams()) {
      int source = newId[edge.getSource()];
      int target = newId[edge.getTarget()];
      if (edge.isMaterial() && splitStreams.containsKey(edge.getSource())) {
        source = subNodeIds.get(Pair.of(edge.getSource(), streamAt(edge, Port.OUT)));
      }
      if (edge.isMaterial() && splitStreams.containsKey(edge.getTarget())) {
        target = subNodeIds.get(Pair.of(edge.getTarget(), streamAt(edge, Port.IN)));
      }
      result.addStream(source, target, edge.getKind(), edge.getTags());
    }

    LOGGER.debug("Split %d multi-stream units", splitStreams.size());
    validate(result);
    return result;
  }

  private static String streamAt(StreamEdge edge, Port port) {
    List<String> ids = edge.getTags().getHeatIntegration().stream()
        .filter(t -> t.getPort() == port).map(HeatIntegrationTag::getStream).distinct()
        .collect(Collectors.toList());
    return ids.size() == 1 ? ids.get(0) : null;
  }

  private static void checkCompletePairs(Flowsheet flowsheet, UnitNode unit, List<String> ids)
      throws AmbiguousHeatIntegrationException {
    Map<String, int[]> counts = new HashMap<>();
    ids.forEach(id -> counts.put(id, new int[2]));

    List<Pair<StreamEdge, Port>> ends = new ArrayList<>();
    flowsheet.getInStreams(unit.getId(), EdgeKind.MATERIAL).forEach(e -> ends.add(Pair.of(e, Port.IN)));
    flowsheet.getOutStreams(unit.getId(), EdgeKind.MATERIAL).forEach(e -> ends.add(Pair.of(e, Port.OUT)));
    for (Pair<StreamEdge, Port> end : ends) {
      String stream = streamAt(end.getLeft(), end.getRight());
      if (stream == null) {
        throw new AmbiguousHeatIntegrationException(
            String.format("Cannot split %s: %s stream has no single heat integration stream id",
                unit.getName(), end.getRight() == Port.IN ? "an entering" : "a leaving"), unit.getName(), null);
      }
      counts.get(stream)[end.getRight().ordinal()]++;
    }

    for (String id : ids) {
      int[] c = counts.get(id);
      if (c[Port.IN.ordinal()] != 1 || c[Port.OUT.ordinal()] != 1) {
        throw new AmbiguousHeatIntegrationException(
            String.format("Cannot split %s: stream %s is used by %d entering and %d leaving streams",
                unit.getName(), id, c[Port.IN.ordinal()], c[Port.OUT.ordinal()]), unit.getName(), id);
      }
    }
  }
}
